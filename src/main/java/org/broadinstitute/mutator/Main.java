package org.broadinstitute.mutator;

import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.mutator.cmdline.CommandLineProgram;
import org.broadinstitute.mutator.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.mutator.exceptions.UserException;
import org.broadinstitute.mutator.tools.mutation.MutateAssemblies;
import org.broadinstitute.mutator.utils.Utils;
import org.broadinstitute.mutator.utils.config.ConfigFactory;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * This is the main class of the mutator and is the way of executing individual command line programs.
 *
 * Programs are looked up by their simple class name among {@link #getClassList()}, so that
 * {@code mutator MutateAssemblies --founder-gvcf ...} runs {@link MutateAssemblies}.
 *
 * If you want your own single command line program, extend this class and override if required:
 *
 * - {@link #getClassList()} to return a list of single classes to include.
 * - {@link #getCommandLineName()} for the name of the toolkit.
 * - {@link #handleResult(Object)} for handle the result of the tool.
 * - {@link #handleNonUserException(Exception)} for handle non {@link UserException}.
 */
public class Main {

    static {
        // Force the JVM locale into US English, so that we don't have to think about number formatting issues.
        Utils.forceJVMLocaleToUSEnglish();
    }

    /**
     * exit value when an issue with the commandline is detected, ie CommandLineException.
     */
    public static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;

    /**
     * Exit value when an unrecoverable {@link UserException} occurs.
     */
    public static final int USER_EXCEPTION_EXIT_VALUE = 2;

    /**
     * exit value when any unrecoverable exception other than {@link UserException} occurs
     */
    public static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;

    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "MUTATOR_STACKTRACE_ON_USER_EXCEPTION";

    /**
     * Prints the given message (may be null) to the provided stream, adding adornments and formatting.
     */
    protected static void printDecoratedExceptionMessage(final PrintStream ps, final Exception e, String prefix){
        Utils.nonNull(ps, "stream");
        Utils.nonNull(e, "exception");
        ps.println("***********************************************************************");
        ps.println();
        ps.println(prefix + e.getMessage());
        ps.println();
        ps.println("***********************************************************************") ;
    }

    /**
     * The single classes we wish to include in our command line.
     */
    protected List<Class<? extends CommandLineProgram>> getClassList() {
        return Collections.singletonList(MutateAssemblies.class);
    }

    /** Returns the command line that will appear in the usage. */
    protected String getCommandLineName() {
        return "mutator";
    }

    /**
     * Reads from the given command-line arguments, pulls out configuration options,
     * and initializes the configuration for this instance of Main.
     */
    protected void parseArgsForConfigSetup(final String[] args) {
        ConfigFactory.getInstance().initializeConfigurationsFromCommandLineArgs(args, "--" + StandardArgumentDefinitions.MUTATOR_CONFIG_FILE_OPTION);
    }

    /**
     * Runs the program named by the first argument with the remaining arguments.
     * This method is not intended to be used outside of the mutator and its tests.
     *
     * @return the result of the program, or null if only the usage was printed
     */
    public Object instanceMain(final String[] args) {
        final CommandLineProgram program = setupConfigAndExtractProgram(args);
        return runCommandLineProgram(program, args);
    }

    /**
     * Run the given command line program with the raw arguments from the command line
     * @param rawArgs these are the raw arguments from the command line, the first will be stripped off
     * @return the result of running  {program} with the given args, possibly null
     */
    protected static Object runCommandLineProgram(final CommandLineProgram program, final String[] rawArgs) {
        if (null == program) return null; // no program found!  This will happen if help was specified with no other arguments
        final String[] mainArgs = Arrays.copyOfRange(rawArgs, 1, rawArgs.length);
        return program.instanceMain(mainArgs);
    }

    /**
     * Set up the configuration and create the {@link CommandLineProgram} to run.
     */
    protected CommandLineProgram setupConfigAndExtractProgram(final String[] args) {
        // Parse our config file path from our arguments and initialize the configuration file.
        parseArgsForConfigSetup(args);
        return extractCommandLineProgram(args);
    }

    /**
     * The entry point to the toolkit from commandline: it uses {@link #instanceMain(String[])} to run the command line
     * program and handle the returned object with {@link #handleResult(Object)}, and exit with 0.
     * If any error occurs, it handles the exception (if non-user exception, through {@link #handleNonUserException(Exception)})
     * and exit with the concrete error exit value.
     *
     * Note: this is the only method that is allowed to call System.exit (because tools may be run from test harness etc)
     */
    protected final void mainEntry(final String[] args) {
        CommandLineProgram program = null;
        try {
            program = setupConfigAndExtractProgram(args);
            final Object result = runCommandLineProgram(program, args);
            handleResult(result);
        } catch (final CommandLineException e){
            if (program != null) {
                System.err.println(program.getUsage());
            }
            handleUserException(e);
            System.exit(COMMANDLINE_EXCEPTION_EXIT_VALUE);
        } catch (final UserException e){
            handleUserException(e);
            System.exit(USER_EXCEPTION_EXIT_VALUE);
        } catch (final Exception e){
            handleNonUserException(e);
            System.exit(ANY_OTHER_EXCEPTION_EXIT_VALUE);
        }
    }

    /**
     * Handle the result returned for a tool. Default implementation prints a message with the string value of the object if it is not null.
     * @param result the result of the tool (may be null)
     */
    protected void handleResult(final Object result) {
        if (result != null) {
            System.out.println("Tool returned:\n" + result);
        }
    }

    /**
     * Handle an exception that was likely caused by user error.
     * This includes {@link UserException} and {@link CommandLineException}
     *
     * Default implementation produces a pretty error message
     * and a stack trace iff {@link #printStackTraceOnUserExceptions()}
     *
     * @param e the exception to handle
     */
    protected void handleUserException(Exception e) {
        printDecoratedExceptionMessage(System.err, e, "A USER ERROR has occurred: ");

        if(printStackTraceOnUserExceptions()) {
            e.printStackTrace();
        } else {
            System.err.println(String.format(
                    "Set the system property %s (-D%s=true) to print the stack trace.",
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY,
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY));
        }
    }

    /**
     * Handle any exception that does not come from the user. Default implementation prints the stack trace.
     * @param exception the exception to handle (never an {@link UserException}).
     */
    protected void handleNonUserException(final Exception exception) {
        exception.printStackTrace();
    }

    /** The entry point to the mutator from commandline. It calls {@link #mainEntry(String[])} from this instance. */
    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    private static boolean printStackTraceOnUserExceptions() {
        return "true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY))
                || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)
                || ConfigFactory.getInstance().getMutatorConfig().stacktraceOnUserException();
    }

    /**
     * Returns the command line program specified, or prints the usage and returns null if none was
     * @throws UserException if the first argument names no known program
     */
    private CommandLineProgram extractCommandLineProgram(final String[] args) {
        final Map<String, Class<? extends CommandLineProgram>> simpleNameToClass = new LinkedHashMap<>();
        for (final Class<? extends CommandLineProgram> clazz : getClassList()) {
            if (getProgramProperty(clazz) == null) {
                throw new IllegalStateException("The class '" + clazz.getSimpleName() + "' is missing the required CommandLineProgramProperties annotation.");
            }
            if (simpleNameToClass.put(clazz.getSimpleName(), clazz) != null) {
                throw new IllegalStateException("Simple class name collision: " + clazz.getName());
            }
        }

        if (args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(System.out, simpleNameToClass);
            return null;
        }
        final Class<? extends CommandLineProgram> clazz = simpleNameToClass.get(args[0]);
        if (clazz == null) {
            printUsage(System.err, simpleNameToClass);
            throw new UserException(String.format("'%s' is not a valid command.", args[0]));
        }
        try {
            return clazz.getDeclaredConstructor().newInstance();
        } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new IllegalStateException("Could not instantiate " + clazz.getName(), e);
        }
    }

    public static CommandLineProgramProperties getProgramProperty(Class<?> clazz) {
        return clazz.getAnnotation(CommandLineProgramProperties.class);
    }

    private void printUsage(final PrintStream destinationStream, final Map<String, Class<? extends CommandLineProgram>> programs) {
        final StringBuilder builder = new StringBuilder();
        builder.append("USAGE: ").append(getCommandLineName()).append(" <program name> [-h]\n\n")
                .append("Available Programs:\n");
        for (final Map.Entry<String, Class<? extends CommandLineProgram>> entry : programs.entrySet()) {
            final CommandLineProgramProperties property = getProgramProperty(entry.getValue());
            final CommandLineProgramGroup group = newProgramGroup(property);
            builder.append(String.format("    %-45s%s\n", entry.getKey(), property.oneLineSummary()));
            builder.append(String.format("    %-45s(%s)\n", "", group.getName()));
        }
        destinationStream.println(builder.toString());
    }

    private static CommandLineProgramGroup newProgramGroup(final CommandLineProgramProperties property) {
        try {
            return property.programGroup().getDeclaredConstructor().newInstance();
        } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new IllegalStateException("Could not instantiate program group " + property.programGroup().getName(), e);
        }
    }
}
