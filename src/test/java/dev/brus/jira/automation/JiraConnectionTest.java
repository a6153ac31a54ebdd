package dev.brus.jira.automation;

import org.junit.Assert;
import org.junit.Test;

public class JiraConnectionTest {
   private final static String TEST_USER_NAME = "automation";
   private final static String TEST_PASSWORD = "s3cret";

   @Test
   public void testApiURLAppendsVersionPath() {
      JiraConnection connection = new JiraConnection("https://jira.example.com", TEST_USER_NAME, TEST_PASSWORD);

      Assert.assertEquals("https://jira.example.com/", connection.getBaseURL());
      Assert.assertEquals("https://jira.example.com/rest/api/latest/", connection.getApiURL());
   }

   @Test
   public void testApiURLKeepsExistingRestPath() {
      JiraConnection connection = new JiraConnection("https://jira.example.com/rest/api/2", TEST_USER_NAME, TEST_PASSWORD);

      Assert.assertEquals("https://jira.example.com/rest/api/2/", connection.getBaseURL());
      Assert.assertEquals("https://jira.example.com/rest/api/2/", connection.getApiURL());
   }

   @Test
   public void testApiURLCollapsesDoubledSlashes() {
      JiraConnection connection = new JiraConnection("http://jira.example.com//tracker/", TEST_USER_NAME, TEST_PASSWORD);

      Assert.assertEquals("http://jira.example.com/tracker/rest/api/latest/", connection.getApiURL());
   }

   @Test
   public void testMissingSettings() {
      String[][] invalidSettings = {
         {"", TEST_USER_NAME, TEST_PASSWORD},
         {null, TEST_USER_NAME, TEST_PASSWORD},
         {"https://jira.example.com", "", TEST_PASSWORD},
         {"https://jira.example.com", TEST_USER_NAME, ""},
         {"https://jira.example.com", TEST_USER_NAME, null},
      };

      for (String[] settings : invalidSettings) {
         try {
            new JiraConnection(settings[0], settings[1], settings[2]);
            Assert.fail("Expected configuration error for " + String.join(",", String.valueOf(settings[0]),
               String.valueOf(settings[1])));
         } catch (JiraConfigurationException e) {
            Assert.assertTrue(e.getMessage().contains("url, username, and password"));
         }
      }
   }

   @Test
   public void testRelativeURL() {
      try {
         new JiraConnection("jira.example.com", TEST_USER_NAME, TEST_PASSWORD);
         Assert.fail();
      } catch (JiraConfigurationException e) {
         Assert.assertTrue(e.getMessage().contains("must be absolute"));
      }
   }

   @Test
   public void testAuthString() {
      JiraConnection connection = new JiraConnection("https://jira.example.com", TEST_USER_NAME, TEST_PASSWORD);

      Assert.assertEquals("Basic YXV0b21hdGlvbjpzM2NyZXQ=", connection.getAuthString());
   }

   @Test
   public void testPasswordNotPrinted() {
      JiraConnection connection = new JiraConnection("https://jira.example.com", TEST_USER_NAME, TEST_PASSWORD);

      Assert.assertFalse(connection.toString().contains(TEST_PASSWORD));
      Assert.assertFalse(connection.getApiURL().contains(TEST_PASSWORD));
      Assert.assertFalse(connection.getBaseURL().contains(TEST_USER_NAME));
   }
}
