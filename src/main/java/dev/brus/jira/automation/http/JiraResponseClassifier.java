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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import dev.brus.jira.automation.JiraOperationException;
import dev.brus.jira.automation.JiraRequestRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link JiraResponse} into a decoded payload or a typed failure.
 *
 * <ul>
 *    <li>2xx: the body decoded as JSON, {@link JsonNull} when there is no body.</li>
 *    <li>4xx with {@code errorMessages} (or {@code errors}) in the body: {@link JiraRequestRejectedException}.</li>
 *    <li>anything else: {@link JiraOperationException} with the status line and the operation description.</li>
 * </ul>
 */
public class JiraResponseClassifier {
   private final static Logger logger = LoggerFactory.getLogger(JiraResponseClassifier.class);

   public JsonElement classify(JiraResponse response, String description) throws JiraOperationException {
      if (!response.isSuccess()) {
         throw classifyFailure(response, description);
      }

      if (!response.hasBody()) {
         return JsonNull.INSTANCE;
      }

      try {
         return JsonParser.parseString(response.getBodyAsString());
      } catch (JsonParseException e) {
         JiraOperationException exception = new JiraOperationException(description + " (malformed response)",
            response.getStatusCode(), response.getStatusLine());
         exception.initCause(e);
         throw exception;
      }
   }

   public JiraOperationException classifyFailure(JiraResponse response, String description) {
      int statusCode = response.getStatusCode();

      if (statusCode >= 400 && statusCode < 500) {
         List<String> errorMessages = parseErrorMessages(response);
         if (errorMessages != null && !errorMessages.isEmpty()) {
            logger.debug(description + " rejected: " + errorMessages);
            return new JiraRequestRejectedException(description, statusCode, response.getStatusLine(), errorMessages);
         }
      }

      return new JiraOperationException(description, statusCode, response.getStatusLine());
   }

   /**
    * Returns the messages of a structured error body, or {@code null} if the body is not one.
    */
   protected List<String> parseErrorMessages(JiraResponse response) {
      if (!response.hasBody()) {
         return null;
      }

      JsonElement bodyElement;
      try {
         bodyElement = JsonParser.parseString(response.getBodyAsString());
      } catch (JsonParseException e) {
         logger.debug("Unstructured error body: " + e.getMessage());
         return null;
      }

      if (bodyElement == null || !bodyElement.isJsonObject()) {
         return null;
      }

      JsonObject bodyObject = bodyElement.getAsJsonObject();
      JsonElement errorMessagesElement = bodyObject.get("errorMessages");
      JsonElement errorsElement = bodyObject.get("errors");

      boolean structured = (errorMessagesElement != null && errorMessagesElement.isJsonArray()) ||
         (errorsElement != null && errorsElement.isJsonObject());
      if (!structured) {
         return null;
      }

      List<String> errorMessages = new ArrayList<>();
      if (errorMessagesElement != null && errorMessagesElement.isJsonArray()) {
         for (JsonElement errorMessageElement : errorMessagesElement.getAsJsonArray()) {
            if (errorMessageElement != null && !errorMessageElement.isJsonNull()) {
               errorMessages.add(errorMessageElement.isJsonPrimitive() ?
                  errorMessageElement.getAsString() : errorMessageElement.toString());
            }
         }
      }
      if (errorsElement != null && errorsElement.isJsonObject()) {
         for (Map.Entry<String, JsonElement> error : errorsElement.getAsJsonObject().entrySet()) {
            JsonElement errorValue = error.getValue();
            String errorText = errorValue.isJsonPrimitive() ? errorValue.getAsString() : errorValue.toString();
            errorMessages.add(error.getKey() + ": " + errorText);
         }
      }

      return errorMessages;
   }
}
