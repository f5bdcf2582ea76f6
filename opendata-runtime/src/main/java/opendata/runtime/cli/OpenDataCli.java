/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package opendata.runtime.cli;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import com.google.common.annotations.VisibleForTesting;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;

import lombok.extern.slf4j.Slf4j;

import opendata.catalog.schema.DocumentSchema;
import opendata.catalog.source.CatalogSource;
import opendata.runtime.ExtractionJob;
import opendata.runtime.MessageWriter;
import opendata.source.Source;
import opendata.source.extractor.DataRecordException;
import opendata.stream.StreamHandle;


/**
 * Command line entry point: extracts the datasets listed in a configuration file and writes them to stdout.
 *
 * <pre>
 *   opendata --config job.conf            extract all configured datasets
 *   opendata --config job.conf --discover print the catalog of streams and exit
 * </pre>
 *
 * Logs go to stderr, stdout only carries messages.
 */
@Slf4j
public class OpenDataCli {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;

  private static final Option CONFIG_OPTION = Option.builder("c").argName("config file")
      .desc("Job configuration file (HOCON or JSON) listing the dataset IRIs").hasArg().longOpt("config").build();
  private static final Option DISCOVER_OPTION = Option.builder("d")
      .desc("Print the catalog of streams instead of extracting them").longOpt("discover").build();
  private static final Option HELP_OPTION =
      Option.builder("h").argName("help").desc("Display usage information").longOpt("help").build();

  private final Source<DocumentSchema, Map<String, Object>> source;
  private final PrintStream out;

  public OpenDataCli(Source<DocumentSchema, Map<String, Object>> source, PrintStream out) {
    this.source = source;
    this.out = out;
  }

  public static void main(String[] args) {
    System.exit(new OpenDataCli(new CatalogSource(), System.out).run(args));
  }

  /**
   * @return the process exit code
   */
  public int run(String[] args) {
    CommandLine cmd;
    try {
      cmd = new DefaultParser().parse(options(), args);
    } catch (ParseException pe) {
      System.err.println(pe.getMessage());
      printUsage();
      return EXIT_FAILURE;
    }

    if (cmd.hasOption(HELP_OPTION.getOpt())) {
      printUsage();
      return EXIT_OK;
    }
    if (!cmd.hasOption(CONFIG_OPTION.getOpt())) {
      printUsage();
      return EXIT_FAILURE;
    }

    Config config;
    try {
      config = loadConfig(cmd.getOptionValue(CONFIG_OPTION.getOpt()));
    } catch (ConfigException ce) {
      log.error("Cannot load configuration: " + ce.getMessage(), ce);
      return EXIT_FAILURE;
    }

    try {
      List<StreamHandle<DocumentSchema, Map<String, Object>>> streams = this.source.getStreams(config);
      MessageWriter writer = new MessageWriter(this.out);
      if (cmd.hasOption(DISCOVER_OPTION.getOpt())) {
        writer.writeCatalog(streams);
      } else {
        new ExtractionJob(writer).run(streams);
      }
      return EXIT_OK;
    } catch (ConfigException ce) {
      log.error("Invalid configuration: " + ce.getMessage(), ce);
      return EXIT_FAILURE;
    } catch (IOException | DataRecordException exc) {
      log.error("Extraction failed: " + exc.getMessage(), exc);
      return EXIT_FAILURE;
    } finally {
      shutdown();
    }
  }

  private void shutdown() {
    try {
      this.source.shutdown();
    } catch (IOException ioe) {
      log.warn("Failed to shut down source", ioe);
    }
  }

  @VisibleForTesting
  static Config loadConfig(String path) {
    Config fileConfig = ConfigFactory.parseFile(new File(path), ConfigParseOptions.defaults().setAllowMissing(false));
    return fileConfig.withFallback(ConfigFactory.load()).resolve();
  }

  private void printUsage() {
    PrintWriter writer = new PrintWriter(System.err);
    HelpFormatter formatter = new HelpFormatter();
    formatter.printHelp(writer, formatter.getWidth(), OpenDataCli.class.getSimpleName(), null, options(),
        formatter.getLeftPadding(), formatter.getDescPadding(), null, true);
    writer.flush();
  }

  private static Options options() {
    Options options = new Options();
    options.addOption(CONFIG_OPTION);
    options.addOption(DISCOVER_OPTION);
    options.addOption(HELP_OPTION);
    return options;
  }
}
