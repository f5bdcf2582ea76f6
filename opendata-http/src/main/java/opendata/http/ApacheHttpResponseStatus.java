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

package opendata.http;

import lombok.Getter;
import lombok.Setter;


/**
 * The status of a handled {@link org.apache.http.client.methods.CloseableHttpResponse}, together with
 * its content when the response was successful
 */
@Getter
@Setter
public class ApacheHttpResponseStatus {
  private StatusType type;
  private int statusCode;
  private byte[] content = null;
  private String contentType = null;

  public ApacheHttpResponseStatus(StatusType type) {
    this.type = type;
  }

  public boolean isOk() {
    return this.type == StatusType.OK;
  }
}
