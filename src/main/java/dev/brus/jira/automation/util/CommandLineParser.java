package dev.brus.jira.automation.util;

import java.io.PrintWriter;

import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

public class CommandLineParser {

   private Options options;
   private org.apache.commons.cli.CommandLineParser parser;

   public CommandLineParser() {
      this.options = new Options();
      this.parser = new DefaultParser();
   }

   public CommandLine parse(String[] args) throws ParseException {
      return new CommandLine(parser.parse(options, args));
   }

   public CommandLine parse(String[] args, EnvironmentLookup environment) throws ParseException {
      return new CommandLine(parser.parse(options, args), environment);
   }

   public void addOption(String opt, String longOpt, boolean required, boolean hasArg, String description) {
      Option option = new Option(opt, longOpt, hasArg, description);
      option.setRequired(required);

      options.addOption(option);
   }

   public void printHelp(String syntax, PrintWriter writer) {
      HelpFormatter helpFormatter = new HelpFormatter();
      helpFormatter.printHelp(writer, HelpFormatter.DEFAULT_WIDTH, syntax, null, options,
         HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
      writer.flush();
   }

   /**
    * Source of environment variables, {@link System#getenv(String)} outside of tests.
    */
   public interface EnvironmentLookup {
      String get(String name);
   }
}
