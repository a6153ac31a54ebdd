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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A 4xx response whose body carried the tracker's own error messages, e.g. a JQL syntax error.
 */
public class JiraRequestRejectedException extends JiraOperationException {

   private final List<String> errorMessages;

   public JiraRequestRejectedException(String description, int statusCode, String statusLine, List<String> errorMessages) {
      super(description + " " + statusLine + "\n" + String.join("\n", errorMessages), description, statusCode, statusLine);
      this.errorMessages = Collections.unmodifiableList(new ArrayList<>(errorMessages));
   }

   public List<String> getErrorMessages() {
      return errorMessages;
   }
}
