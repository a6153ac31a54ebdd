package dev.brus.jira.automation;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import dev.brus.jira.automation.issue.Attachment;
import dev.brus.jira.automation.issue.Comment;
import dev.brus.jira.automation.issue.Issue;
import dev.brus.jira.automation.transition.Transition;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.apache.commons.io.FileUtils;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class JiraClientTest {
   private final static String TEST_USER_NAME = "automation";
   private final static String TEST_PASSWORD = "s3cret";

   @Rule
   public TemporaryFolder testFolder = new TemporaryFolder();

   private static MockResponse jsonResponse(int code, String body) {
      return new MockResponse().setResponseCode(code)
         .addHeader("Content-Type", "application/json; charset=utf-8")
         .setBody(body);
   }

   private static MockResponse transitionsResponse() {
      return jsonResponse(200, "{\"transitions\":[" +
         "{\"id\":\"4\",\"name\":\"Start Progress\",\"to\":{\"name\":\"In Progress\"}}," +
         "{\"id\":\"2\",\"name\":\"Close Issue\",\"to\":{\"name\":\"Closed\"}}]}");
   }

   private static JiraClient createClient(MockWebServer mockWebServer) {
      return new JiraClient(mockWebServer.url("/").toString(), TEST_USER_NAME, TEST_PASSWORD);
   }

   @Test
   public void testCreateIssue() throws Exception {
      MockWebServer mockWebServer = new MockWebServer();
      mockWebServer.start();

      mockWebServer.enqueue(jsonResponse(201, "{\"id\":\"10001\",\"key\":\"PROJ-1\"," +
         "\"self\":\"" + mockWebServer.url("/rest/api/latest/issue/10001") + "\"}"));

      Issue issue = createClient(mockWebServer).createIssue("PROJ", "Bug", "Nightly job failed", "See attached log");

      Assert.assertEquals("PROJ-1", issue.getKey());
      Assert.assertEquals("10001", issue.getId());

      RecordedRequest recordedRequest = mockWebServer.takeRequest();
      Assert.assertEquals("POST", recordedRequest.getMethod());
      Assert.assertEquals("/rest/api/latest/issue/", recordedRequest.getPath());
      Assert.assertEquals(JsonParser.parseString("{\"fields\":{\"summary\":\"Nightly job failed\"," +
         "\"description\":\"See attached log\",\"issuetype\":{\"name\":\"Bug\"},\"project\":{\"key\":\"PROJ\"}}}"),
         JsonParser.parseString(recordedRequest.getBody().readUtf8()));

      mockWebServer.shutdown();
   }

   @Test
   public void testCreateIssueRejected() throws Exception {
      MockWebServer mockWebServer = new MockWebServer();
      mockWebServer.start();

      mockWebServer.enqueue(jsonResponse(400, "{\"errorMessages\":[],\"errors\":{\"project\":\"project is required\"}}"));

      try {
         createClient(mockWebServer).createIssue("", "Bug", "Nightly job failed", null);
         Assert.fail();
      } catch (JiraRequestRejectedException e) {
         Assert.assertEquals(400, e.getStatusCode());
         Assert.assertEquals(List.of("project: project is required"), e.getErrorMessages());
         Assert.assertTrue(e.getMessage().startsWith("Error creating new JIRA issue Nightly job failed"));
      }

      mockWebServer.shutdown();
   }

   @Test
   public void testGetIssue() throws Exception {
      MockWebServer mockWebServer = new MockWebServer();
      mockWebServer.start();

      mockWebServer.enqueue(jsonResponse(200, "{\"id\":\"10001\",\"key\":\"PROJ-1\"," +
         "\"fields\":{\"summary\":\"Nightly job failed\",\"status\":{\"name\":\"Open\"}}}"));

      Issue issue = createClient(mockWebServer).getIssue("PROJ-1");

      Assert.assertEquals("PROJ-1", issue.getKey());
      Assert.assertEquals("Open", issue.getFieldAsString("status"));

      RecordedRequest recordedRequest = mockWebServer.takeRequest();
      Assert.assertEquals("GET", recordedRequest.getMethod());
      Assert.assertEquals("/rest/api/latest/issue/PROJ-1", recordedRequest.getPath());

      mockWebServer.shutdown();
   }

   @Test
   public void testGetMissingIssue() throws Exception {
      MockWebServer mockWebServer = new MockWebServer();
      mockWebServer.start();

      mockWebServer.enqueue(jsonResponse(404, "{\"errorMessages\":[\"Issue Does Not Exist\"],\"errors\":{}}"));

      try {
         createClient(mockWebServer).getIssue("PROJ-404");
         Assert.fail();
      } catch (JiraOperationException e) {
         Assert.assertEquals(404, e.getStatusCode());
         Assert.assertTrue(e.getMessage().contains("Error getting JIRA issue PROJ-404"));
         Assert.assertTrue(e.getMessage().contains("Issue Does Not Exist"));
      }

      mockWebServer.shutdown();
   }

   @Test
   public void testUpdateIssue() throws Exception {
      MockWebServer mockWebServer = new MockWebServer();
      mockWebServer.start();

      mockWebServer.enqueue(new MockResponse().setResponseCode(204));

      Map<String, Object> fields = Map.of("summary", "New summary");
      String key = createClient(mockWebServer).updateIssue("PROJ-1", fields);

      Assert.assertEquals("PROJ-1", key);

      RecordedRequest recordedRequest = mockWebServer.takeRequest();
      Assert.assertEquals("PUT", recordedRequest.getMethod());
      Assert.assertEquals("/rest/api/latest/issue/PROJ-1", recordedRequest.getPath());
      Assert.assertEquals(JsonParser.parseString("{\"fields\":{\"summary\":\"New summary\"}}"),
         JsonParser.parseString(recordedRequest.getBody().readUtf8()));

      mockWebServer.shutdown();
   }

   @Test
   public void testDeleteIssue() throws Exception {
      MockWebServer mockWebServer = new MockWebServer();
      mockWebServer.start();

      mockWebServer.enqueue(new MockResponse().setResponseCode(204));

      Assert.assertEquals("PROJ-1", createClient(mockWebServer).deleteIssue("PROJ-1"));

      RecordedRequest recordedRequest = mockWebServer.takeRequest();
      Assert.assertEquals("DELETE", recordedRequest.getMethod());
      Assert.assertEquals("/rest/api/latest/issue/PROJ-1", recordedRequest.getPath());

      mockWebServer.shutdown();
   }

   @Test
   public void testCreateComment() throws Exception {
      MockWebServer mockWebServer = new MockWebServer();
      mockWebServer.start();

      mockWebServer.enqueue(jsonResponse(201, "{\"id\":\"100\",\"body\":\"Build 42 failed again\"}"));

      Comment comment = createClient(mockWebServer).createComment("PROJ-1", "Build 42 failed again");

      Assert.assertEquals("100", comment.getId());
      Assert.assertEquals("Build 42 failed again", comment.getBody());

      RecordedRequest recordedRequest = mockWebServer.takeRequest();
      Assert.assertEquals("/rest/api/latest/issue/PROJ-1/comment", recordedRequest.getPath());
      Assert.assertEquals(JsonParser.parseString("{\"body\":\"Build 42 failed again\"}"),
         JsonParser.parseString(recordedRequest.getBody().readUtf8()));

      mockWebServer.shutdown();
   }

   @Test
   public void testAttachFileToIssue() throws Exception {
      MockWebServer mockWebServer = new MockWebServer();
      mockWebServer.start();

      File logFile = testFolder.newFile("heap.bin");
      FileUtils.writeStringToFile(logFile, "heap dump", StandardCharsets.UTF_8);

      mockWebServer.enqueue(jsonResponse(200, "[{\"id\":\"20\",\"filename\":\"heap.bin\",\"size\":9}]"));

      List<Attachment> attachments = createClient(mockWebServer).attachFileToIssue("PROJ-1", logFile);

      Assert.assertEquals(1, attachments.size());
      Assert.assertEquals("heap.bin", attachments.get(0).getFilename());
      Assert.assertEquals(9, attachments.get(0).getSize());

      RecordedRequest recordedRequest = mockWebServer.takeRequest();
      Assert.assertEquals("POST", recordedRequest.getMethod());
      Assert.assertEquals("/rest/api/latest/issue/PROJ-1/attachments", recordedRequest.getPath());
      Assert.assertEquals("nocheck", recordedRequest.getHeader("X-Atlassian-Token"));
      Assert.assertTrue(recordedRequest.getHeader("Content-Type").startsWith("multipart/form-data; boundary="));

      String body = recordedRequest.getBody().readUtf8();
      String boundary = recordedRequest.getHeader("Content-Type").substring("multipart/form-data; boundary=".length());
      Assert.assertTrue(body.startsWith("--" + boundary + "\r\n"));
      Assert.assertTrue(body.contains("Content-Disposition: form-data; name=\"file\"; filename=\"heap.bin\"\r\n"));
      Assert.assertTrue(body.contains("Content-Type: application/octet-stream\r\n"));
      Assert.assertTrue(body.contains("\r\n\r\nheap dump\r\n"));
      Assert.assertTrue(body.endsWith("--" + boundary + "--\r\n"));
      Assert.assertEquals(recordedRequest.getBodySize(), Long.parseLong(recordedRequest.getHeader("Content-Length")));

      mockWebServer.shutdown();
   }

   @Test
   public void testAttachFileWithQuotedName() throws Exception {
      MockWebServer mockWebServer = new MockWebServer();
      mockWebServer.start();

      File logFile = testFolder.newFile("build.txt");
      FileUtils.writeStringToFile(logFile, "log", StandardCharsets.UTF_8);

      mockWebServer.enqueue(jsonResponse(200, "[{\"id\":\"21\",\"filename\":\"nightly \\\"42\\\".txt\"}]"));

      List<Attachment> attachments = createClient(mockWebServer).attachFileToIssue("PROJ-1", logFile, "nightly \"42\".txt");

      Assert.assertEquals("nightly \"42\".txt", attachments.get(0).getFilename());

      String body = mockWebServer.takeRequest().getBody().readUtf8();
      Assert.assertTrue(body.contains("filename=\"nightly %2242%22.txt\""));

      mockWebServer.shutdown();
   }

   @Test
   public void testGetTransitions() throws Exception {
      MockWebServer mockWebServer = new MockWebServer();
      mockWebServer.start();

      mockWebServer.enqueue(transitionsResponse());

      List<Transition> transitions = createClient(mockWebServer).getTransitions("PROJ-1");

      Assert.assertEquals(2, transitions.size());
      Assert.assertEquals("Closed", transitions.get(1).getToStatus());

      mockWebServer.shutdown();
   }

   @Test
   public void testTransitionIssue() throws Exception {
      MockWebServer mockWebServer = new MockWebServer();
      mockWebServer.start();

      mockWebServer.enqueue(transitionsResponse());
      mockWebServer.enqueue(new MockResponse().setResponseCode(204));

      JsonObject payload = new JsonObject();
      JsonObject fieldsObject = new JsonObject();
      fieldsObject.addProperty("customfield_10010", 3);
      payload.add("fields", fieldsObject);

      Assert.assertEquals("PROJ-1", createClient(mockWebServer).transitionIssue("PROJ-1", "Start Progress", payload));

      Assert.assertEquals("/rest/api/latest/issue/PROJ-1/transitions", mockWebServer.takeRequest().getPath());

      RecordedRequest recordedRequest = mockWebServer.takeRequest();
      Assert.assertEquals("POST", recordedRequest.getMethod());
      Assert.assertEquals("/rest/api/latest/issue/PROJ-1/transitions", recordedRequest.getPath());
      Assert.assertEquals(JsonParser.parseString("{\"fields\":{\"customfield_10010\":3},\"transition\":{\"id\":\"4\"}}"),
         JsonParser.parseString(recordedRequest.getBody().readUtf8()));

      // the caller's payload is not modified
      Assert.assertFalse(payload.has("transition"));

      mockWebServer.shutdown();
   }

   @Test
   public void testTransitionIssueUnknownName() throws Exception {
      MockWebServer mockWebServer = new MockWebServer();
      mockWebServer.start();

      mockWebServer.enqueue(jsonResponse(200, "{\"transitions\":[" +
         "{\"id\":\"2\",\"name\":\"Close Issue\",\"to\":{\"name\":\"Closed\"}}]}"));
      mockWebServer.enqueue(jsonResponse(400, "{\"errorMessages\":[\"Missing 'id' or 'name' in transition\"],\"errors\":{}}"));

      try {
         createClient(mockWebServer).transitionIssue("PROJ-1", "Start Progress");
         Assert.fail();
      } catch (JiraOperationException e) {
         Assert.assertEquals(400, e.getStatusCode());
         Assert.assertTrue(e.getMessage().startsWith("Error with Start Progress for JIRA issue PROJ-1"));
      }

      mockWebServer.takeRequest();
      Assert.assertEquals(JsonParser.parseString("{\"transition\":{\"id\":null}}"),
         JsonParser.parseString(mockWebServer.takeRequest().getBody().readUtf8()));

      mockWebServer.shutdown();
   }

   @Test
   public void testCloseIssue() throws Exception {
      MockWebServer mockWebServer = new MockWebServer();
      mockWebServer.start();

      mockWebServer.enqueue(transitionsResponse());
      mockWebServer.enqueue(new MockResponse().setResponseCode(204));

      Assert.assertEquals("PROJ-1", createClient(mockWebServer).closeIssue("PROJ-1", "Fixed", "done"));

      mockWebServer.takeRequest();
      RecordedRequest recordedRequest = mockWebServer.takeRequest();
      Assert.assertEquals(JsonParser.parseString("{\"update\":{\"comment\":[{\"add\":{\"body\":\"done\"}}]}," +
         "\"fields\":{\"resolution\":{\"name\":\"Fixed\"}},\"transition\":{\"id\":\"2\"}}"),
         JsonParser.parseString(recordedRequest.getBody().readUtf8()));

      mockWebServer.shutdown();
   }

   @Test
   public void testCloseIssueDefaults() throws Exception {
      MockWebServer mockWebServer = new MockWebServer();
      mockWebServer.start();

      mockWebServer.enqueue(transitionsResponse());
      mockWebServer.enqueue(new MockResponse().setResponseCode(204));

      createClient(mockWebServer).closeIssue("PROJ-1");

      mockWebServer.takeRequest();
      JsonObject closingObject = JsonParser.parseString(mockWebServer.takeRequest().getBody().readUtf8()).getAsJsonObject();
      Assert.assertFalse(closingObject.has("fields"));
      Assert.assertEquals(JsonParser.parseString("{\"update\":{\"comment\":[{\"add\":{\"body\":\"Issue closed by script\"}}]}," +
         "\"transition\":{\"id\":\"2\"}}"), closingObject);

      mockWebServer.shutdown();
   }

   @Test
   public void testMakeBrowseUrl() {
      JiraClient client = new JiraClient("https://jira.example.com/rest/api/2", TEST_USER_NAME, TEST_PASSWORD);

      Assert.assertEquals("https://jira.example.com/rest/api/2/browse/PROJ-7", client.makeBrowseUrl("PROJ-7"));

      client = new JiraClient("https://jira.example.com", TEST_USER_NAME, TEST_PASSWORD);

      Assert.assertEquals("https://jira.example.com/browse/PROJ-7", client.makeBrowseUrl("PROJ-7"));
   }
}
