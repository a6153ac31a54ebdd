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
import java.util.Map;
import java.util.Set;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Ordered bag of issue field values.
 *
 * <p>Values are JSON elements, so a field may hold a string, a number, a boolean, a nested object or an
 * array. Field names and values are not checked: the tracker decides what it accepts.</p>
 */
public class IssueFields {

   private final static Gson gson = new GsonBuilder().serializeNulls().create();

   private final JsonObject fieldsObject;

   public IssueFields() {
      this.fieldsObject = new JsonObject();
   }

   public static IssueFields of(Map<String, ?> fields) {
      IssueFields issueFields = new IssueFields();
      for (Map.Entry<String, ?> field : fields.entrySet()) {
         issueFields.set(field.getKey(), field.getValue());
      }
      return issueFields;
   }

   public static IssueFields of(JsonObject fieldsObject) {
      IssueFields issueFields = new IssueFields();
      for (Map.Entry<String, JsonElement> field : fieldsObject.entrySet()) {
         issueFields.set(field.getKey(), field.getValue());
      }
      return issueFields;
   }

   public IssueFields set(String name, String value) {
      return set(name, value != null ? new JsonPrimitive(value) : JsonNull.INSTANCE);
   }

   public IssueFields set(String name, Number value) {
      return set(name, value != null ? new JsonPrimitive(value) : JsonNull.INSTANCE);
   }

   public IssueFields set(String name, Boolean value) {
      return set(name, value != null ? new JsonPrimitive(value) : JsonNull.INSTANCE);
   }

   public IssueFields set(String name, JsonElement value) {
      fieldsObject.add(name, value != null ? value.deepCopy() : JsonNull.INSTANCE);
      return this;
   }

   /**
    * Sets a value converted with Gson: maps become objects, collections and arrays become JSON arrays.
    */
   public IssueFields set(String name, Object value) {
      if (value instanceof JsonElement) {
         return set(name, (JsonElement)value);
      }
      return set(name, gson.toJsonTree(value));
   }

   /**
    * Sets a reference field such as {@code {"name": "High"}} for priority.
    */
   public IssueFields setName(String name, String referenceName) {
      JsonObject referenceObject = new JsonObject();
      referenceObject.addProperty("name", referenceName);
      return set(name, referenceObject);
   }

   public IssueFields setKey(String name, String referenceKey) {
      JsonObject referenceObject = new JsonObject();
      referenceObject.addProperty("key", referenceKey);
      return set(name, referenceObject);
   }

   public IssueFields remove(String name) {
      fieldsObject.remove(name);
      return this;
   }

   public JsonElement get(String name) {
      JsonElement value = fieldsObject.get(name);
      return value != null ? value.deepCopy() : null;
   }

   public boolean contains(String name) {
      return fieldsObject.has(name);
   }

   public Set<String> names() {
      return Collections.unmodifiableSet(new LinkedHashSet<>(fieldsObject.keySet()));
   }

   public int size() {
      return fieldsObject.size();
   }

   public boolean isEmpty() {
      return fieldsObject.size() == 0;
   }

   public JsonObject toJsonObject() {
      return fieldsObject.deepCopy();
   }

   @Override
   public String toString() {
      return fieldsObject.toString();
   }
}
