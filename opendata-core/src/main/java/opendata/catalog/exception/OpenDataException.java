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

package opendata.catalog.exception;

import java.io.IOException;


/**
 * Base class of the failures raised while resolving, describing or downloading a catalog dataset.
 *
 * <p>
 *   None of these failures is retried; they propagate to the caller of the failing component.
 * </p>
 */
public class OpenDataException extends IOException {

  private static final long serialVersionUID = 1L;

  public OpenDataException(String message) {
    super(message);
  }

  public OpenDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
