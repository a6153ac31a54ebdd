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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import dev.brus.jira.automation.http.JiraRequestExecutor;
import dev.brus.jira.automation.http.JiraResponse;
import dev.brus.jira.automation.http.JiraResponseClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up transition ids by name on the current state of an issue.
 *
 * <p>Nothing is cached: the transitions offered depend on where the issue sits in its workflow,
 * so every resolution lists them again.</p>
 */
public class TransitionResolver {
   private final static Logger logger = LoggerFactory.getLogger(TransitionResolver.class);

   private final JiraRequestExecutor executor;
   private final JiraResponseClassifier classifier;

   public TransitionResolver(JiraRequestExecutor executor, JiraResponseClassifier classifier) {
      this.executor = executor;
      this.classifier = classifier;
   }

   public List<Transition> getTransitions(String issueKey) throws IOException {
      JiraResponse response = executor.execute(JiraRequestExecutor.GET, "issue/" + issueKey + "/transitions");
      JsonElement transitionsListElement = classifier.classify(response,
         "Error getting available transitions for JIRA issue " + issueKey);

      List<Transition> transitions = new ArrayList<>();
      if (transitionsListElement.isJsonObject()) {
         JsonElement transitionsElement = transitionsListElement.getAsJsonObject().get("transitions");
         if (transitionsElement != null && transitionsElement.isJsonArray()) {
            JsonArray transitionsArray = transitionsElement.getAsJsonArray();
            for (JsonElement transitionElement : transitionsArray) {
               if (transitionElement != null && transitionElement.isJsonObject()) {
                  transitions.add(Transition.fromJson(transitionElement.getAsJsonObject()));
               }
            }
         }
      }

      return Collections.unmodifiableList(transitions);
   }

   /**
    * Returns the id of the transition named exactly {@code transitionName}, or {@code null} if the issue
    * offers none. When the name is listed more than once the last entry wins.
    */
   public String resolveTransitionId(String issueKey, String transitionName) throws IOException {
      String transitionId = null;

      for (Transition transition : getTransitions(issueKey)) {
         if (transition.getName() != null && transition.getName().equals(transitionName)) {
            transitionId = transition.getId();
         }
      }

      if (transitionId == null) {
         logger.warn("No transition named '" + transitionName + "' available for issue " + issueKey);
      } else {
         logger.debug("Resolved transition '" + transitionName + "' of issue " + issueKey + " to " + transitionId);
      }

      return transitionId;
   }
}
