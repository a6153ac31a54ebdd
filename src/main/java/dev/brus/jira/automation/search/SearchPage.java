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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import dev.brus.jira.automation.issue.Issue;

/**
 * One page of a JQL search.
 *
 * <p>A query the tracker refused carries its error messages, a total of 0 and no issues.
 * A total of -1 means the tracker did not report one.</p>
 */
public final class SearchPage {

   private final int total;
   private final int startAt;
   private final int maxResults;
   private final List<Issue> issues;
   private final List<String> errors;

   public SearchPage(int total, int startAt, int maxResults, List<Issue> issues) {
      this(total, startAt, maxResults, issues, Collections.emptyList());
   }

   public SearchPage(int total, int startAt, int maxResults, List<Issue> issues, List<String> errors) {
      this.total = total;
      this.startAt = startAt;
      this.maxResults = maxResults;
      this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
      this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
   }

   public static SearchPage rejected(int startAt, int maxResults, List<String> errors) {
      return new SearchPage(0, startAt, maxResults, Collections.emptyList(), errors);
   }

   public int getTotal() {
      return total;
   }

   public int getStartAt() {
      return startAt;
   }

   public int getMaxResults() {
      return maxResults;
   }

   public List<Issue> getIssues() {
      return issues;
   }

   public List<String> getErrors() {
      return errors;
   }

   public boolean hasErrors() {
      return !errors.isEmpty();
   }

   @Override
   public String toString() {
      return "SearchPage{total=" + total + ", startAt=" + startAt + ", maxResults=" + maxResults +
         ", issues=" + issues.size() + ", errors=" + errors + "}";
   }
}
