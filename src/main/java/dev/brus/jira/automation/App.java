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
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import dev.brus.jira.automation.issue.Attachment;
import dev.brus.jira.automation.issue.Issue;
import dev.brus.jira.automation.issue.IssueFields;
import dev.brus.jira.automation.search.SearchPage;
import dev.brus.jira.automation.search.SearchPager;
import dev.brus.jira.automation.transition.Transition;
import dev.brus.jira.automation.util.CommandLine;
import dev.brus.jira.automation.util.CommandLineParser;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point for batch scripts.
 */
public class App {
   private final static Logger logger = LoggerFactory.getLogger(App.class);

   private static final String COMMAND_OPTION = "command";
   private static final String URL_OPTION = "url";
   private static final String USER_OPTION = "user";
   private static final String PASSWORD_OPTION = "password";
   private static final String KEY_OPTION = "key";
   private static final String PROJECT_OPTION = "project";
   private static final String TYPE_OPTION = "type";
   private static final String SUMMARY_OPTION = "summary";
   private static final String DESCRIPTION_OPTION = "description";
   private static final String FIELDS_OPTION = "fields";
   private static final String TEXT_OPTION = "text";
   private static final String FILE_OPTION = "file";
   private static final String TRANSITION_OPTION = "transition";
   private static final String RESOLUTION_OPTION = "resolution";
   private static final String JQL_OPTION = "jql";
   private static final String START_AT_OPTION = "start-at";
   private static final String MAX_RESULTS_OPTION = "max-results";
   private static final String HELP_OPTION = "help";

   private static final String URL_VARIABLE = "JIRA_URL";
   private static final String USER_VARIABLE = "JIRA_USER";
   private static final String PASSWORD_VARIABLE = "JIRA_PASSWORD";

   private static final String DEFAULT_ISSUE_TYPE = "Bug";

   private final PrintStream out;
   private final CommandLineParser.EnvironmentLookup environment;
   private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

   public App(PrintStream out, CommandLineParser.EnvironmentLookup environment) {
      this.out = out;
      this.environment = environment;
   }

   public static void main(String[] args) throws Exception {
      new App(System.out, System::getenv).run(args);
   }

   public void run(String[] args) throws IOException, ParseException {
      CommandLineParser parser = new CommandLineParser();
      parser.addOption(null, COMMAND_OPTION, false, true, "the command, one of create, get, update, delete, comment, attach, transitions, transition, close, search, search-all, browse-url");
      parser.addOption(null, URL_OPTION, false, true, "the tracker base URL, i.e. https://issues.example.com/, defaults to $" + URL_VARIABLE);
      parser.addOption(null, USER_OPTION, false, true, "the user name, defaults to $" + USER_VARIABLE);
      parser.addOption(null, PASSWORD_OPTION, false, true, "the password or API token, defaults to $" + PASSWORD_VARIABLE);
      parser.addOption(null, KEY_OPTION, false, true, "the issue key, i.e. PROJ-123");
      parser.addOption(null, PROJECT_OPTION, false, true, "the project key of a new issue, i.e. PROJ");
      parser.addOption(null, TYPE_OPTION, false, true, "the type of a new issue, i.e. " + DEFAULT_ISSUE_TYPE);
      parser.addOption(null, SUMMARY_OPTION, false, true, "the summary of a new issue");
      parser.addOption(null, DESCRIPTION_OPTION, false, true, "the description of a new issue");
      parser.addOption(null, FIELDS_OPTION, false, true, "the fields to update as a JSON object, i.e. {\"summary\":\"New summary\"}");
      parser.addOption(null, TEXT_OPTION, false, true, "the comment text");
      parser.addOption(null, FILE_OPTION, false, true, "the file to attach");
      parser.addOption(null, TRANSITION_OPTION, false, true, "the transition name, i.e. \"Start Progress\"");
      parser.addOption(null, RESOLUTION_OPTION, false, true, "the resolution of a closed issue, i.e. Fixed");
      parser.addOption(null, JQL_OPTION, false, true, "the JQL query");
      parser.addOption(null, START_AT_OPTION, false, true, "the offset of the first search result");
      parser.addOption(null, MAX_RESULTS_OPTION, false, true, "the search page size, i.e. " + SearchPager.DEFAULT_MAX_RESULTS);
      parser.addOption(null, HELP_OPTION, false, false, "print this help");

      CommandLine line = parser.parse(args, environment);

      String command = line.getOptionValue(COMMAND_OPTION);
      if (line.hasOption(HELP_OPTION) || command == null) {
         parser.printHelp("jira-automation --command <command> [options]", new PrintWriter(out));
         return;
      }

      if ("browse-url".equals(command)) {
         out.println(createClient(line).makeBrowseUrl(requireOption(line, KEY_OPTION)));
         return;
      }

      JiraClient client = createClient(line);
      logger.debug("Executing " + command + " on " + client.getConnection());

      switch (command) {
         case "create":
            print(client.createIssue(
               requireOption(line, PROJECT_OPTION),
               line.getOptionValue(TYPE_OPTION, DEFAULT_ISSUE_TYPE),
               requireOption(line, SUMMARY_OPTION),
               line.getOptionValue(DESCRIPTION_OPTION)).toJson());
            break;
         case "get":
            print(client.getIssue(requireOption(line, KEY_OPTION)).toJson());
            break;
         case "update":
            out.println(client.updateIssue(requireOption(line, KEY_OPTION), parseFields(requireOption(line, FIELDS_OPTION))));
            break;
         case "delete":
            out.println(client.deleteIssue(requireOption(line, KEY_OPTION)));
            break;
         case "comment":
            print(client.createComment(requireOption(line, KEY_OPTION), requireOption(line, TEXT_OPTION)).toJson());
            break;
         case "attach":
            JsonArray attachmentsArray = new JsonArray();
            for (Attachment attachment : client.attachFileToIssue(requireOption(line, KEY_OPTION),
               new File(requireOption(line, FILE_OPTION)))) {
               attachmentsArray.add(attachment.toJson());
            }
            print(attachmentsArray);
            break;
         case "transitions":
            JsonArray transitionsArray = new JsonArray();
            for (Transition transition : client.getTransitions(requireOption(line, KEY_OPTION))) {
               JsonObject transitionObject = new JsonObject();
               transitionObject.addProperty("id", transition.getId());
               transitionObject.addProperty("name", transition.getName());
               transitionObject.addProperty("to", transition.getToStatus());
               transitionsArray.add(transitionObject);
            }
            print(transitionsArray);
            break;
         case "transition":
            out.println(client.transitionIssue(requireOption(line, KEY_OPTION), requireOption(line, TRANSITION_OPTION)));
            break;
         case "close":
            out.println(client.closeIssue(requireOption(line, KEY_OPTION),
               line.getOptionValue(RESOLUTION_OPTION), line.getOptionValue(TEXT_OPTION)));
            break;
         case "search":
            SearchPage page = client.searchIssues(requireOption(line, JQL_OPTION),
               line.getIntOptionValue(START_AT_OPTION, 0),
               line.getIntOptionValue(MAX_RESULTS_OPTION, SearchPager.DEFAULT_MAX_RESULTS));
            print(toJson(page));
            break;
         case "search-all":
            List<Issue> issues = client.allSearchResults(requireOption(line, JQL_OPTION),
               line.getIntOptionValue(MAX_RESULTS_OPTION, SearchPager.DEFAULT_MAX_RESULTS));
            print(toJson(issues));
            break;
         default:
            throw new IllegalArgumentException("Unknown command: " + command);
      }
   }

   private JiraClient createClient(CommandLine line) {
      return new JiraClient(
         line.getOptionOrEnvValue(URL_OPTION, URL_VARIABLE),
         line.getOptionOrEnvValue(USER_OPTION, USER_VARIABLE),
         line.getOptionOrEnvValue(PASSWORD_OPTION, PASSWORD_VARIABLE));
   }

   private String requireOption(CommandLine line, String option) {
      String value = line.getOptionValue(option);
      if (value == null) {
         throw new IllegalArgumentException("Missing required option --" + option);
      }
      return value;
   }

   private IssueFields parseFields(String fields) {
      JsonElement fieldsElement = JsonParser.parseString(fields);
      if (!fieldsElement.isJsonObject()) {
         throw new IllegalArgumentException("Option --" + FIELDS_OPTION + " requires a JSON object: " + fields);
      }
      return IssueFields.of(fieldsElement.getAsJsonObject());
   }

   private JsonObject toJson(SearchPage page) {
      JsonObject pageObject = new JsonObject();
      pageObject.addProperty("total", page.getTotal());
      pageObject.addProperty("startAt", page.getStartAt());
      pageObject.addProperty("maxResults", page.getMaxResults());
      pageObject.add("issues", toJson(page.getIssues()));
      if (page.hasErrors()) {
         JsonArray errorsArray = new JsonArray();
         for (String error : page.getErrors()) {
            errorsArray.add(error);
         }
         pageObject.add("errors", errorsArray);
      }
      return pageObject;
   }

   private JsonArray toJson(List<Issue> issues) {
      JsonArray issuesArray = new JsonArray();
      for (Issue issue : issues) {
         issuesArray.add(issue.toJson());
      }
      return issuesArray;
   }

   private void print(JsonElement element) {
      out.println(gson.toJson(element));
   }
}
