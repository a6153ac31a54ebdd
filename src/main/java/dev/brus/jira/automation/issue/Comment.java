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

package dev.brus.jira.automation.issue;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * A comment as returned by the tracker after it was created.
 */
public final class Comment {

   private final JsonObject commentObject;

   public Comment(JsonObject commentObject) {
      this.commentObject = commentObject.deepCopy();
   }

   public static Comment fromJson(JsonElement commentElement) {
      if (commentElement == null || !commentElement.isJsonObject()) {
         throw new IllegalArgumentException("Comment must be a JSON object: " + commentElement);
      }
      return new Comment(commentElement.getAsJsonObject());
   }

   public String getId() {
      JsonElement idElement = commentObject.get("id");
      return idElement != null && idElement.isJsonPrimitive() ? idElement.getAsString() : null;
   }

   public String getBody() {
      JsonElement bodyElement = commentObject.get("body");
      if (bodyElement == null || bodyElement.isJsonNull()) {
         return null;
      }
      // rich text bodies are returned as documents, keep them as JSON text
      return bodyElement.isJsonPrimitive() ? bodyElement.getAsString() : bodyElement.toString();
   }

   public JsonObject toJson() {
      return commentObject.deepCopy();
   }

   @Override
   public String toString() {
      return "Comment{id=" + getId() + "}";
   }
}
