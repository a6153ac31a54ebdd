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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Snapshot of an issue as returned by the tracker.
 *
 * <p>The whole response is kept, so fields the client does not know about survive. Instances are
 * never refreshed: fetch the issue again to see its current state.</p>
 */
public final class Issue {

   private final JsonObject issueObject;

   public Issue(JsonObject issueObject) {
      this.issueObject = issueObject.deepCopy();
   }

   public static Issue fromJson(JsonElement issueElement) {
      if (issueElement == null || !issueElement.isJsonObject()) {
         throw new IllegalArgumentException("Issue must be a JSON object: " + issueElement);
      }
      return new Issue(issueElement.getAsJsonObject());
   }

   public String getKey() {
      return getString(issueObject, "key");
   }

   public String getId() {
      return getString(issueObject, "id");
   }

   public String getSelf() {
      return getString(issueObject, "self");
   }

   public JsonObject getFields() {
      JsonElement fieldsElement = issueObject.get("fields");
      return fieldsElement != null && fieldsElement.isJsonObject() ?
         fieldsElement.getAsJsonObject().deepCopy() : new JsonObject();
   }

   public Set<String> getFieldNames() {
      JsonElement fieldsElement = issueObject.get("fields");
      if (fieldsElement == null || !fieldsElement.isJsonObject()) {
         return Collections.emptySet();
      }
      return Collections.unmodifiableSet(new LinkedHashSet<>(fieldsElement.getAsJsonObject().keySet()));
   }

   public JsonElement getField(String name) {
      JsonElement fieldsElement = issueObject.get("fields");
      if (fieldsElement == null || !fieldsElement.isJsonObject()) {
         return null;
      }
      JsonElement fieldElement = fieldsElement.getAsJsonObject().get(name);
      return fieldElement != null ? fieldElement.deepCopy() : null;
   }

   /**
    * Returns a string field, or the {@code name} of an object field such as {@code status}.
    */
   public String getFieldAsString(String name) {
      JsonElement fieldElement = getField(name);
      if (fieldElement == null || fieldElement.isJsonNull()) {
         return null;
      }
      if (fieldElement.isJsonObject()) {
         return getString(fieldElement.getAsJsonObject(), "name");
      }
      if (fieldElement.isJsonPrimitive()) {
         return fieldElement.getAsString();
      }
      return fieldElement.toString();
   }

   public JsonObject toJson() {
      return issueObject.deepCopy();
   }

   private static String getString(JsonObject object, String name) {
      JsonElement element = object.get(name);
      return element != null && element.isJsonPrimitive() ? element.getAsString() : null;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof Issue)) {
         return false;
      }
      return issueObject.equals(((Issue)o).issueObject);
   }

   @Override
   public int hashCode() {
      return issueObject.hashCode();
   }

   @Override
   public String toString() {
      return "Issue{key=" + getKey() + "}";
   }
}
