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

package dev.brus.jira.automation.search;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import dev.brus.jira.automation.JiraOperationException;
import dev.brus.jira.automation.JiraRequestRejectedException;
import dev.brus.jira.automation.http.JiraRequestExecutor;
import dev.brus.jira.automation.http.JiraResponse;
import dev.brus.jira.automation.http.JiraResponseClassifier;
import dev.brus.jira.automation.issue.Issue;
import dev.brus.jira.automation.issue.IssuePayloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs JQL searches one page at a time, or accumulates every page of a query.
 */
public class SearchPager {
   private final static Logger logger = LoggerFactory.getLogger(SearchPager.class);

   public final static int DEFAULT_MAX_RESULTS = 100;

   private final static int BAD_REQUEST = 400;

   private final JiraRequestExecutor executor;
   private final JiraResponseClassifier classifier;

   public SearchPager(JiraRequestExecutor executor, JiraResponseClassifier classifier) {
      this.executor = executor;
      this.classifier = classifier;
   }

   /**
    * Fetches one page. A 400 response with error messages, i.e. a bad query, is returned as a page
    * carrying those messages; every other failure is thrown.
    */
   public SearchPage searchIssues(String jql, int startAt, int maxResults) throws IOException {
      String description = describe(jql, startAt, maxResults);

      JiraResponse response = executor.execute(JiraRequestExecutor.POST, "search/",
         IssuePayloads.search(jql, startAt, maxResults));

      if (!response.isSuccess()) {
         JiraOperationException failure = classifier.classifyFailure(response, description);
         if (failure instanceof JiraRequestRejectedException && failure.getStatusCode() == BAD_REQUEST) {
            List<String> errors = ((JiraRequestRejectedException)failure).getErrorMessages();
            logger.debug("Search rejected: " + errors);
            return SearchPage.rejected(startAt, maxResults, errors);
         }
         throw failure;
      }

      JsonElement resultsElement = classifier.classify(response, description);
      if (!resultsElement.isJsonObject()) {
         throw new JiraOperationException(description + " (unexpected response " + resultsElement + ")",
            response.getStatusCode(), response.getStatusLine());
      }

      return parseSearchPage(resultsElement.getAsJsonObject(), startAt, maxResults);
   }

   public List<Issue> allSearchResults(String jql) throws IOException {
      return allSearchResults(jql, DEFAULT_MAX_RESULTS);
   }

   /**
    * Accumulates every page of {@code jql}, in order. If any page carries errors they are thrown and
    * the issues gathered so far are dropped.
    */
   public List<Issue> allSearchResults(String jql, int maxResults) throws IOException {
      if (maxResults <= 0) {
         throw new IllegalArgumentException("maxResults must be positive: " + maxResults);
      }

      List<Issue> allResults = new ArrayList<>();
      int startAt = 0;
      int total = -1;

      while (true) {
         SearchPage page = searchIssues(jql, startAt, maxResults);

         if (page.hasErrors()) {
            throw new JiraRequestRejectedException(describe(jql, startAt, maxResults),
               BAD_REQUEST, String.valueOf(BAD_REQUEST), page.getErrors());
         }

         allResults.addAll(page.getIssues());
         total = page.getTotal();

         // the tracker may cap the page size below the requested one
         int pageSize = maxResults;
         if (page.getMaxResults() > 0 && page.getMaxResults() < maxResults) {
            pageSize = page.getMaxResults();
         }
         startAt += pageSize;

         // Only a short page ends the loop, the reported total may change between pages.
         // This under-fetches if the tracker ever returns a short page before the end.
         if (page.getIssues().size() < pageSize) {
            break;
         }
      }

      if (total >= 0 && allResults.size() != total) {
         logger.warn("Loaded " + allResults.size() + "/" + total + " issues for " + jql);
      } else {
         logger.debug("Loaded " + allResults.size() + " issues for " + jql);
      }

      return allResults;
   }

   protected SearchPage parseSearchPage(JsonObject resultsObject, int startAt, int maxResults) {
      List<Issue> issues = new ArrayList<>();

      JsonElement issuesElement = resultsObject.get("issues");
      if (issuesElement != null && issuesElement.isJsonArray()) {
         for (JsonElement issueElement : issuesElement.getAsJsonArray()) {
            issues.add(Issue.fromJson(issueElement));
         }
      }

      return new SearchPage(
         getInt(resultsObject, "total", -1),
         getInt(resultsObject, "startAt", startAt),
         getInt(resultsObject, "maxResults", maxResults),
         issues);
   }

   private static int getInt(JsonObject object, String name, int defaultValue) {
      JsonElement element = object.get(name);
      return element != null && element.isJsonPrimitive() ? element.getAsInt() : defaultValue;
   }

   private static String describe(String jql, int startAt, int maxResults) {
      return "Error searching for " + jql + " from " + startAt + " for " + maxResults + " results";
   }
}
