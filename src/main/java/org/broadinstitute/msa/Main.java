package org.broadinstitute.msa;

import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.msa.cmdline.CommandLineProgram;
import org.broadinstitute.msa.exceptions.UserException;
import org.broadinstitute.msa.tools.SummarizeStockholmAlignment;
import org.broadinstitute.msa.utils.Utils;
import org.broadinstitute.msa.utils.config.ConfigFactory;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * This is the main class of the toolkit and is the way of executing individual command line programs.
 *
 * The first argument names the program by its simple class name; the remaining arguments are handed to it.
 *
 * Note: this is the only class that is allowed to call System.exit, and only from {@link #mainEntry(String[])}.
 */
public class Main {

    static {
        // Force the JVM locale into US English so number formatting is stable across hosts.
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

    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "MSA_STACKTRACE_ON_USER_EXCEPTION";

    /**
     * Prints the given message (may be null) to the provided stream, adding adornments and formatting.
     */
    protected static void printDecoratedExceptionMessage(final PrintStream ps, final Exception e, final String prefix){
        Utils.nonNull(ps, "stream");
        Utils.nonNull(e, "exception");
        ps.println("***********************************************************************");
        ps.println();
        ps.println(prefix + e.getMessage());
        ps.println();
        ps.println("***********************************************************************") ;
    }

    /**
     * The programs available from the command line.
     */
    protected List<Class<? extends CommandLineProgram>> getClassList() {
        return Collections.singletonList(SummarizeStockholmAlignment.class);
    }

    /** Returns the command line that will appear in the usage. */
    protected String getCommandLineName() {
        return "msa";
    }

    /**
     * Runs the program named by the first argument and returns its result, or null if no program was named.
     *
     * This method is not intended to be used outside of the toolkit and tests.
     */
    public Object instanceMain(final String[] args) {
        final CommandLineProgram program = extractCommandLineProgram(args, getClassList(), getCommandLineName());
        return runCommandLineProgram(program, args);
    }

    /**
     * Run the given command line program with the raw arguments from the command line
     * @param rawArgs these are the raw arguments from the command line, the first will be stripped off
     * @return the result of running {program} with the given args, possibly null
     */
    protected static Object runCommandLineProgram(final CommandLineProgram program, final String[] rawArgs) {
        if (null == program) {
            return null; // no program found! This will happen if help was specified with no other arguments
        }
        final String[] mainArgs = Arrays.copyOfRange(rawArgs, 1, rawArgs.length);
        return program.instanceMain(mainArgs);
    }

    /**
     * The entry point to the toolkit from commandline: it uses {@link #instanceMain(String[])} to run the command line
     * program and exits with the concrete error exit value if anything goes wrong.
     */
    protected final void mainEntry(final String[] args) {
        CommandLineProgram program = null;
        try {
            program = extractCommandLineProgram(args, getClassList(), getCommandLineName());
            runCommandLineProgram(program, args);
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
     * Handle an exception that was likely caused by user error.
     * This includes {@link UserException} and {@link CommandLineException}
     *
     * @param e the exception to handle
     */
    protected void handleUserException(final Exception e) {
        printDecoratedExceptionMessage(System.err, e, "A USER ERROR has occurred: ");

        if (printStackTraceOnUserExceptions()) {
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

    /** The entry point from the commandline. It calls {@link #mainEntry(String[])} from this instance. */
    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    private static boolean printStackTraceOnUserExceptions() {
        return "true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY))
                || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)
                || ConfigFactory.getInstance().getStockholmConfig().stacktraceOnUserException();
    }

    /**
     * Returns the command line program specified, or null after printing the usage if help was asked for.
     * @throws UserException if the program name is unknown
     */
    private CommandLineProgram extractCommandLineProgram(final String[] args,
                                                         final List<Class<? extends CommandLineProgram>> classList,
                                                         final String commandLineName) {
        final Map<String, Class<? extends CommandLineProgram>> simpleNameToClass = new LinkedHashMap<>();
        for (final Class<? extends CommandLineProgram> clazz : classList) {
            if (clazz.getAnnotation(CommandLineProgramProperties.class) == null) {
                throw new IllegalStateException("The class " + clazz.getSimpleName() +
                        " is missing the required CommandLineProgramProperties annotation");
            }
            if (simpleNameToClass.put(clazz.getSimpleName(), clazz) != null) {
                throw new IllegalStateException("Simple class name collision: " + clazz.getName());
            }
        }

        if (args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(System.out, simpleNameToClass, commandLineName);
            return null;
        }
        final Class<? extends CommandLineProgram> clazz = simpleNameToClass.get(args[0]);
        if (clazz == null) {
            printUsage(System.err, simpleNameToClass, commandLineName);
            throw new UserException(String.format("'%s' is not a valid command. Available commands are: %s",
                    args[0], String.join(", ", simpleNameToClass.keySet())));
        }
        try {
            return clazz.getDeclaredConstructor().newInstance();
        } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new IllegalStateException("Could not instantiate " + clazz.getName(), e);
        }
    }

    private static void printUsage(final PrintStream destinationStream,
                                   final Map<String, Class<? extends CommandLineProgram>> simpleNameToClass,
                                   final String commandLineName) {
        final StringBuilder builder = new StringBuilder();
        builder.append("USAGE: ").append(commandLineName).append(" <program name> [-h]\n\n")
                .append("Available Programs:\n");
        simpleNameToClass.forEach((name, clazz) -> {
            final CommandLineProgramProperties properties = clazz.getAnnotation(CommandLineProgramProperties.class);
            if (!properties.omitFromCommandLine()) {
                builder.append(String.format("    %-45s %s\n", name, properties.oneLineSummary()));
            }
        });
        destinationStream.println(builder);
    }
}
