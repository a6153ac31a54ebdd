package dev.brus.jira.automation.util;

public class CommandLine {

   private org.apache.commons.cli.CommandLine commandLine;
   private CommandLineParser.EnvironmentLookup environment;

   public CommandLine(org.apache.commons.cli.CommandLine commandLine) {
      this(commandLine, System::getenv);
   }

   public CommandLine(org.apache.commons.cli.CommandLine commandLine, CommandLineParser.EnvironmentLookup environment) {
      this.commandLine = commandLine;
      this.environment = environment;
   }

   public String getOptionValue(String option) {
      return commandLine.getOptionValue(option);
   }

   public String getOptionValue(String option, String defaultValue) {
      return commandLine.getOptionValue(option, defaultValue);
   }

   /**
    * Returns the option value, falling back to the environment variable {@code variable}.
    */
   public String getOptionOrEnvValue(String option, String variable) {
      String value = commandLine.getOptionValue(option);
      return value != null ? value : environment.get(variable);
   }

   public int getIntOptionValue(String option, int defaultValue) {
      String value = commandLine.getOptionValue(option);
      if (value == null) {
         return defaultValue;
      }
      try {
         return Integer.parseInt(value);
      } catch (NumberFormatException e) {
         throw new IllegalArgumentException("Option " + option + " requires a number: " + value, e);
      }
   }

   public boolean hasOption(String option) {
      return commandLine.hasOption(option);
   }
}
