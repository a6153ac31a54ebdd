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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

public final class Attachment {

   private final JsonObject attachmentObject;

   public Attachment(JsonObject attachmentObject) {
      this.attachmentObject = attachmentObject.deepCopy();
   }

   /**
    * The upload endpoint answers with an array, one entry per uploaded file.
    */
   public static List<Attachment> listFromJson(JsonElement attachmentsElement) {
      List<Attachment> attachments = new ArrayList<>();

      if (attachmentsElement != null && attachmentsElement.isJsonArray()) {
         for (JsonElement attachmentElement : attachmentsElement.getAsJsonArray()) {
            if (attachmentElement != null && attachmentElement.isJsonObject()) {
               attachments.add(new Attachment(attachmentElement.getAsJsonObject()));
            }
         }
      } else if (attachmentsElement != null && attachmentsElement.isJsonObject()) {
         attachments.add(new Attachment(attachmentsElement.getAsJsonObject()));
      }

      return Collections.unmodifiableList(attachments);
   }

   public String getId() {
      return getString("id");
   }

   public String getFilename() {
      return getString("filename");
   }

   public String getContentURL() {
      return getString("content");
   }

   public long getSize() {
      JsonElement sizeElement = attachmentObject.get("size");
      return sizeElement != null && sizeElement.isJsonPrimitive() ? sizeElement.getAsLong() : -1;
   }

   public JsonObject toJson() {
      return attachmentObject.deepCopy();
   }

   private String getString(String name) {
      JsonElement element = attachmentObject.get(name);
      return element != null && element.isJsonPrimitive() ? element.getAsString() : null;
   }

   @Override
   public String toString() {
      return "Attachment{id=" + getId() + ", filename=" + getFilename() + "}";
   }
}
