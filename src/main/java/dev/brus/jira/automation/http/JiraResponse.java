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

package dev.brus.jira.automation.http;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Raw outcome of one round trip: status, headers and the undecoded body.
 */
public class JiraResponse {

   private final int statusCode;
   private final String reasonPhrase;
   private final Map<String, List<String>> headers;
   private final byte[] body;

   public JiraResponse(int statusCode, String reasonPhrase, Map<String, List<String>> headers, byte[] body) {
      this.statusCode = statusCode;
      this.reasonPhrase = reasonPhrase;

      Map<String, List<String>> headersCopy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
      if (headers != null) {
         for (Map.Entry<String, List<String>> header : headers.entrySet()) {
            // HttpURLConnection reports the status line under a null key
            if (header.getKey() != null) {
               headersCopy.put(header.getKey(), List.copyOf(header.getValue()));
            }
         }
      }
      this.headers = Collections.unmodifiableMap(headersCopy);
      this.body = body != null ? body : new byte[0];
   }

   public int getStatusCode() {
      return statusCode;
   }

   public String getReasonPhrase() {
      return reasonPhrase;
   }

   public String getStatusLine() {
      if (reasonPhrase == null || reasonPhrase.isEmpty()) {
         return String.valueOf(statusCode);
      }
      return statusCode + " " + reasonPhrase;
   }

   public boolean isSuccess() {
      return statusCode >= 200 && statusCode < 300;
   }

   public Map<String, List<String>> getHeaders() {
      return headers;
   }

   public String getHeader(String name) {
      List<String> values = headers.get(name);
      return values != null && !values.isEmpty() ? values.get(0) : null;
   }

   public byte[] getBody() {
      return body.clone();
   }

   public String getBodyAsString() {
      return new String(body, StandardCharsets.UTF_8);
   }

   public boolean hasBody() {
      return body.length > 0;
   }
}
