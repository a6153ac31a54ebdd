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

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * Immutable connection settings of a tracker instance.
 *
 * <p>The API URL is derived from the base URL: a trailing slash is ensured, {@code rest/api/latest/}
 * is appended unless the URL already points into the REST API, and doubled slashes are collapsed.</p>
 *
 * <p>The password is only ever exposed as an encoded {@code Authorization} header value.</p>
 */
public final class JiraConnection {

   public final static String REST_API_PATH = "/rest/api/";
   public final static String DEFAULT_REST_API_PATH = "rest/api/latest/";
   public final static String BROWSE_PATH = "browse/";

   private final static Pattern absoluteURLPattern = Pattern.compile("^https?://.+");

   private final String baseURL;
   private final String apiURL;
   private final String username;
   private final String password;

   public JiraConnection(String url, String username, String password) {
      if (StringUtils.isBlank(url) || StringUtils.isBlank(username) || StringUtils.isBlank(password)) {
         throw new JiraConfigurationException("Need to specify url, username, and password to access JIRA.");
      }

      this.baseURL = url.endsWith("/") ? url : url + "/";
      this.apiURL = resolveApiURL(baseURL);
      this.username = username;
      this.password = password;

      if (!absoluteURLPattern.matcher(apiURL).matches()) {
         throw new JiraConfigurationException("URL for JIRA must be absolute, including 'http://' or 'https://'.");
      }
   }

   static String resolveApiURL(String baseURL) {
      String apiURL = baseURL;

      if (!apiURL.contains(REST_API_PATH)) {
         apiURL += "/" + DEFAULT_REST_API_PATH;
      }
      if (!apiURL.endsWith("/")) {
         apiURL += "/";
      }

      // collapse doubled slashes, then restore the one after the scheme
      return apiURL.replaceAll("/{2,}", "/").replaceFirst(":/", "://");
   }

   public String getBaseURL() {
      return baseURL;
   }

   public String getApiURL() {
      return apiURL;
   }

   public String getUsername() {
      return username;
   }

   public String getAuthString() {
      String token = Base64.getEncoder().encodeToString(
         (username + ":" + password).getBytes(StandardCharsets.UTF_8));
      return "Basic " + token;
   }

   @Override
   public String toString() {
      return "JiraConnection{baseURL=" + baseURL + ", apiURL=" + apiURL + ", username=" + username + "}";
   }
}
