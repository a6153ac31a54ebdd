/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.brus.jira.automation;

import java.io.IOException;

/**
 * Thrown when the tracker answers a request with a non-2xx status.
 *
 * <p>Network failures are not wrapped: they reach the caller as the plain {@link IOException}
 * raised by the connection.</p>
 */
public class JiraOperationException extends IOException {

   private final int statusCode;
   private final String statusLine;
   private final String description;

   public JiraOperationException(String description, int statusCode, String statusLine) {
      super(description + " " + statusLine);
      this.description = description;
      this.statusCode = statusCode;
      this.statusLine = statusLine;
   }

   protected JiraOperationException(String message, String description, int statusCode, String statusLine) {
      super(message);
      this.description = description;
      this.statusCode = statusCode;
      this.statusLine = statusLine;
   }

   public int getStatusCode() {
      return statusCode;
   }

   public String getStatusLine() {
      return statusLine;
   }

   public String getDescription() {
      return description;
   }
}
