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

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;

import com.google.gson.JsonObject;
import dev.brus.jira.automation.http.JiraRequestExecutor;
import dev.brus.jira.automation.http.JiraResponse;
import dev.brus.jira.automation.http.JiraResponseClassifier;
import dev.brus.jira.automation.issue.Attachment;
import dev.brus.jira.automation.issue.Comment;
import dev.brus.jira.automation.issue.Issue;
import dev.brus.jira.automation.issue.IssueFields;
import dev.brus.jira.automation.issue.IssuePayloads;
import dev.brus.jira.automation.search.SearchPage;
import dev.brus.jira.automation.search.SearchPager;
import dev.brus.jira.automation.transition.Transition;
import dev.brus.jira.automation.transition.TransitionResolver;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.RequestBody;
import okio.Buffer;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for scripts that create, inspect, change and close issues.
 *
 * <p>Issues are plain snapshots: the client keeps no state besides its {@link JiraConnection}, does not
 * cache anything and never retries. A non-2xx answer is thrown as {@link JiraOperationException}, a network
 * failure as the underlying {@link IOException}.</p>
 */
public class JiraClient {
   private final static Logger logger = LoggerFactory.getLogger(JiraClient.class);

   private final static String XSRF_TOKEN_HEADER = "X-Atlassian-Token";
   private final static MediaType OCTET_STREAM = MediaType.get("application/octet-stream");

   private final JiraConnection connection;
   private final JiraRequestExecutor executor;
   private final JiraResponseClassifier classifier;
   private final TransitionResolver transitionResolver;
   private final SearchPager searchPager;

   public JiraClient(String url, String username, String password) {
      this(new JiraConnection(url, username, password));
   }

   public JiraClient(JiraConnection connection) {
      this.connection = connection;
      this.executor = new JiraRequestExecutor(connection);
      this.classifier = new JiraResponseClassifier();
      this.transitionResolver = new TransitionResolver(executor, classifier);
      this.searchPager = new SearchPager(executor, classifier);
   }

   public JiraConnection getConnection() {
      return connection;
   }

   public Issue createIssue(String project, String type, String summary, String description) throws IOException {
      JiraResponse response = executor.execute(JiraRequestExecutor.POST, "issue/",
         IssuePayloads.createIssue(project, type, summary, description));

      Issue issue = Issue.fromJson(classifier.classify(response, "Error creating new JIRA issue " + summary));
      logger.info("Created issue " + issue.getKey());

      return issue;
   }

   public Issue getIssue(String key) throws IOException {
      JiraResponse response = executor.execute(JiraRequestExecutor.GET, "issue/" + key);

      return Issue.fromJson(classifier.classify(response, "Error getting JIRA issue " + key));
   }

   public String updateIssue(String key, Map<String, ?> fields) throws IOException {
      return updateIssue(key, IssueFields.of(fields));
   }

   public String updateIssue(String key, IssueFields fields) throws IOException {
      JiraResponse response = executor.execute(JiraRequestExecutor.PUT, "issue/" + key,
         IssuePayloads.updateIssue(fields));

      classifier.classify(response, "Error updating JIRA issue " + key);
      logger.info("Updated issue " + key + " fields " + fields.names());

      return key;
   }

   public String deleteIssue(String key) throws IOException {
      JiraResponse response = executor.execute(JiraRequestExecutor.DELETE, "issue/" + key);

      classifier.classify(response, "Error deleting JIRA issue " + key);
      logger.info("Deleted issue " + key);

      return key;
   }

   public Comment createComment(String key, String text) throws IOException {
      JiraResponse response = executor.execute(JiraRequestExecutor.POST, "issue/" + key + "/comment",
         IssuePayloads.comment(text));

      Comment comment = Comment.fromJson(classifier.classify(response,
         "Error creating new JIRA comment for " + key + " : " + text));
      logger.info("Commented issue " + key);

      return comment;
   }

   public List<Attachment> attachFileToIssue(String key, File file) throws IOException {
      return attachFileToIssue(key, file, file.getName());
   }

   public List<Attachment> attachFileToIssue(String key, File file, String filename) throws IOException {
      MultipartBody multipartBody = new MultipartBody.Builder()
         .setType(MultipartBody.FORM)
         .addFormDataPart("file", filename, RequestBody.create(FileUtils.readFileToByteArray(file), OCTET_STREAM))
         .build();

      Buffer multipartBuffer = new Buffer();
      multipartBody.writeTo(multipartBuffer);

      JiraResponse response = executor.execute(JiraRequestExecutor.POST, "issue/" + key + "/attachments",
         multipartBuffer.readByteArray(), multipartBody.contentType().toString(), Map.of(XSRF_TOKEN_HEADER, "nocheck"));

      List<Attachment> attachments = Attachment.listFromJson(classifier.classify(response,
         "Error attaching " + filename + " to JIRA issue " + key + ":"));
      logger.info("Attached " + filename + " to issue " + key);

      return attachments;
   }

   public List<Transition> getTransitions(String key) throws IOException {
      return transitionResolver.getTransitions(key);
   }

   public String transitionIssue(String key, String transitionName) throws IOException {
      return transitionIssue(key, transitionName, new JsonObject());
   }

   /**
    * Resolves {@code transitionName} on the issue as it is now and executes it with {@code payload},
    * e.g. fields or an added comment. An unknown name is sent as a null id and fails on the tracker side.
    */
   public String transitionIssue(String key, String transitionName, JsonObject payload) throws IOException {
      String transitionId = transitionResolver.resolveTransitionId(key, transitionName);

      JiraResponse response = executor.execute(JiraRequestExecutor.POST, "issue/" + key + "/transitions",
         IssuePayloads.transition(payload, transitionId));

      classifier.classify(response, "Error with " + transitionName + " for JIRA issue " + key + ":");
      logger.info("Executed " + transitionName + " on issue " + key);

      return key;
   }

   public String closeIssue(String key) throws IOException {
      return closeIssue(key, null, null);
   }

   public String closeIssue(String key, String resolution, String comment) throws IOException {
      return transitionIssue(key, IssuePayloads.CLOSE_TRANSITION_NAME, IssuePayloads.closeIssue(resolution, comment));
   }

   public SearchPage searchIssues(String jql, int startAt, int maxResults) throws IOException {
      return searchPager.searchIssues(jql, startAt, maxResults);
   }

   public List<Issue> allSearchResults(String jql) throws IOException {
      return searchPager.allSearchResults(jql);
   }

   public List<Issue> allSearchResults(String jql, int maxResults) throws IOException {
      return searchPager.allSearchResults(jql, maxResults);
   }

   public String makeBrowseUrl(String key) {
      return connection.getBaseURL() + JiraConnection.BROWSE_PATH + key;
   }
}
