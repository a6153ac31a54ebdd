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

package dev.brus.jira.automation.transition;

import java.util.Objects;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * A workflow transition available on an issue at the time it was listed.
 */
public final class Transition {

   private final String id;
   private final String name;
   private final String toStatus;

   public Transition(String id, String name, String toStatus) {
      this.id = id;
      this.name = name;
      this.toStatus = toStatus;
   }

   public static Transition fromJson(JsonObject transitionObject) {
      JsonElement idElement = transitionObject.get("id");
      JsonElement nameElement = transitionObject.get("name");
      JsonElement toElement = transitionObject.get("to");

      String toStatus = null;
      if (toElement != null && toElement.isJsonObject()) {
         JsonElement toNameElement = toElement.getAsJsonObject().get("name");
         toStatus = toNameElement != null && toNameElement.isJsonPrimitive() ? toNameElement.getAsString() : null;
      }

      return new Transition(
         idElement != null && idElement.isJsonPrimitive() ? idElement.getAsString() : null,
         nameElement != null && nameElement.isJsonPrimitive() ? nameElement.getAsString() : null,
         toStatus);
   }

   public String getId() {
      return id;
   }

   public String getName() {
      return name;
   }

   public String getToStatus() {
      return toStatus;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof Transition)) {
         return false;
      }
      Transition that = (Transition)o;
      return Objects.equals(id, that.id) && Objects.equals(name, that.name) && Objects.equals(toStatus, that.toStatus);
   }

   @Override
   public int hashCode() {
      return Objects.hash(id, name, toStatus);
   }

   @Override
   public String toString() {
      return "Transition{id=" + id + ", name=" + name + ", toStatus=" + toStatus + "}";
   }
}
