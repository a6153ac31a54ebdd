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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

import com.google.gson.JsonElement;
import dev.brus.jira.automation.JiraConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends authenticated requests to the REST API root of a {@link JiraConnection}.
 *
 * <p>Each call is exactly one round trip. Transport failures propagate as {@link IOException};
 * HTTP level failures are returned as a {@link JiraResponse} for the classifier.</p>
 */
public class JiraRequestExecutor {
   private final static Logger logger = LoggerFactory.getLogger(JiraRequestExecutor.class);

   public final static String GET = "GET";
   public final static String POST = "POST";
   public final static String PUT = "PUT";
   public final static String DELETE = "DELETE";

   public final static String APPLICATION_JSON = "application/json";

   private final static Set<String> methods = Set.of(GET, POST, PUT, DELETE);

   private final JiraConnection connection;

   public JiraRequestExecutor(JiraConnection connection) {
      this.connection = connection;
   }

   public JiraConnection getConnection() {
      return connection;
   }

   public JiraResponse execute(String method, String path) throws IOException {
      return execute(method, path, null, null, Collections.emptyMap());
   }

   public JiraResponse execute(String method, String path, JsonElement body) throws IOException {
      return execute(method, path, body.toString().getBytes(StandardCharsets.UTF_8),
         APPLICATION_JSON, Collections.emptyMap());
   }

   public JiraResponse execute(String method, String path, byte[] body, String contentType,
                               Map<String, String> headers) throws IOException {
      if (!methods.contains(method)) {
         throw new IllegalArgumentException("Unsupported HTTP method: " + method);
      }

      HttpURLConnection httpConnection = createConnection(path);
      try {
         httpConnection.setRequestMethod(method);

         for (Map.Entry<String, String> header : headers.entrySet()) {
            httpConnection.setRequestProperty(header.getKey(), header.getValue());
         }

         if (body != null) {
            if (contentType != null) {
               httpConnection.setRequestProperty("Content-Type", contentType);
            }
            httpConnection.setDoOutput(true);
            httpConnection.setFixedLengthStreamingMode(body.length);

            try (OutputStream outputStream = httpConnection.getOutputStream()) {
               outputStream.write(body);
            }
         }

         int statusCode = httpConnection.getResponseCode();
         byte[] responseBody;
         try (InputStream inputStream = getResponseStream(httpConnection, statusCode)) {
            responseBody = inputStream != null ? inputStream.readAllBytes() : null;
         }

         logger.debug(method + " " + httpConnection.getURL() + " returned " + statusCode);

         return new JiraResponse(statusCode, httpConnection.getResponseMessage(),
            httpConnection.getHeaderFields(), responseBody);
      } finally {
         httpConnection.disconnect();
      }
   }

   protected HttpURLConnection createConnection(String path) throws IOException {
      URL url = new URL(connection.getApiURL() + path);
      logger.debug("Connecting to " + url);
      HttpURLConnection httpConnection = (HttpURLConnection)url.openConnection();
      httpConnection.setRequestProperty("Accept", APPLICATION_JSON);
      httpConnection.setRequestProperty("Authorization", connection.getAuthString());

      return httpConnection;
   }

   private InputStream getResponseStream(HttpURLConnection httpConnection, int statusCode) throws IOException {
      if (statusCode >= 400) {
         return httpConnection.getErrorStream();
      }
      return httpConnection.getInputStream();
   }
}
