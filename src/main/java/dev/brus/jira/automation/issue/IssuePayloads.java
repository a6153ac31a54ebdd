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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.apache.commons.lang3.StringUtils;

/**
 * Builds the nested JSON request bodies the tracker expects.
 */
public final class IssuePayloads {

   public final static String CLOSE_TRANSITION_NAME = "Close Issue";
   public final static String DEFAULT_CLOSE_COMMENT = "Issue closed by script";
   public final static String NAVIGABLE_FIELDS = "*navigable";

   private IssuePayloads() {
   }

   public static JsonObject createIssue(String project, String type, String summary, String description) {
      JsonObject issueObject = new JsonObject();
      {
         JsonObject fieldsObject = new JsonObject();
         fieldsObject.addProperty("summary", summary);
         if (description != null) {
            fieldsObject.addProperty("description", description);
         }
         JsonObject issueTypeObject = new JsonObject();
         issueTypeObject.addProperty("name", type);
         fieldsObject.add("issuetype", issueTypeObject);
         JsonObject projectObject = new JsonObject();
         projectObject.addProperty("key", project);
         fieldsObject.add("project", projectObject);
         issueObject.add("fields", fieldsObject);
      }
      return issueObject;
   }

   public static JsonObject updateIssue(IssueFields fields) {
      JsonObject issueObject = new JsonObject();
      issueObject.add("fields", fields.toJsonObject());
      return issueObject;
   }

   public static JsonObject comment(String text) {
      JsonObject commentObject = new JsonObject();
      commentObject.addProperty("body", text);
      return commentObject;
   }

   /**
    * Transition body for {@value #CLOSE_TRANSITION_NAME}: always adds a comment, sets the resolution
    * only when one is given.
    */
   public static JsonObject closeIssue(String resolution, String comment) {
      if (comment == null) {
         comment = DEFAULT_CLOSE_COMMENT;
      }

      JsonObject closingObject = new JsonObject();
      {
         JsonObject updateObject = new JsonObject();
         JsonArray commentArray = new JsonArray();
         JsonObject addObject = new JsonObject();
         addObject.add("add", comment(comment));
         commentArray.add(addObject);
         updateObject.add("comment", commentArray);
         closingObject.add("update", updateObject);
      }
      if (StringUtils.isNotEmpty(resolution)) {
         JsonObject fieldsObject = new JsonObject();
         JsonObject resolutionObject = new JsonObject();
         resolutionObject.addProperty("name", resolution);
         fieldsObject.add("resolution", resolutionObject);
         closingObject.add("fields", fieldsObject);
      }
      return closingObject;
   }

   /**
    * Copies {@code payload} and sets {@code transition.id}. A {@code null} id is sent as JSON null.
    */
   public static JsonObject transition(JsonObject payload, String transitionId) {
      JsonObject transitionObject = payload != null ? payload.deepCopy() : new JsonObject();
      JsonObject idObject = new JsonObject();
      idObject.addProperty("id", transitionId);
      transitionObject.add("transition", idObject);
      return transitionObject;
   }

   public static JsonObject search(String jql, int startAt, int maxResults) {
      JsonObject queryObject = new JsonObject();
      queryObject.addProperty("jql", jql);
      queryObject.addProperty("startAt", startAt);
      queryObject.addProperty("maxResults", maxResults);
      JsonArray fieldsArray = new JsonArray();
      fieldsArray.add(NAVIGABLE_FIELDS);
      queryObject.add("fields", fieldsArray);
      return queryObject;
   }
}
