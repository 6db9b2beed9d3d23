package org.janelia.surfalign.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.janelia.surfalign.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base parameters for all command line tools.
 */
@Parameters
public class CommandLineParameters implements Serializable {

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help;

    private transient JCommander jCommander;

    public CommandLineParameters() {
        this.help = false;
        this.jCommander = null;
    }

    public void parse(final String[] args,
                      final Class<?> programClass) throws IllegalArgumentException {
        parse(args, programClass, true);
    }

    /**
     * @param  args                 command line arguments.
     * @param  programClass         class with the main method (for usage output).
     * @param  exitOnHelpOrFailure  indicates whether the JVM should exit after printing usage.
     *
     * @throws IllegalArgumentException
     *   if the arguments cannot be parsed and exitOnHelpOrFailure is false.
     */
    public void parse(final String[] args,
                      final Class<?> programClass,
                      final boolean exitOnHelpOrFailure) throws IllegalArgumentException {

        jCommander = new JCommander(this);
        jCommander.setProgramName("java -cp surfalign-client.jar " + programClass.getName());

        String failureMessage = null;
        try {
            jCommander.parse(args);
        } catch (final ParameterException pe) {
            failureMessage = pe.getMessage();
            jCommander.getConsole().println("\nERROR: failed to parse command line arguments\n\n" + failureMessage);
        } catch (final Throwable t) {
            failureMessage = t.getMessage();
            LOG.error("failed to parse command line arguments", t);
        }

        final boolean parseFailed = failureMessage != null;
        if (help || parseFailed) {
            jCommander.getConsole().println("");
            jCommander.usage();
            if (exitOnHelpOrFailure) {
                System.exit(1);
            } else if (parseFailed) {
                throw new IllegalArgumentException("failed to parse command line arguments: " + failureMessage);
            }
        }
    }

    /**
     * @return string representation of these parameters.
     */
    @Override
    public String toString() {
        try {
            return JsonUtils.MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /**
     * Helper (no pun intended) for testing parameter parsing.
     *
     * @param  parameters  parameters instance to test.
     */
    public static void parseHelp(final CommandLineParameters parameters) {
        parameters.parse(new String[] { "--help" },
                         parameters.getClass().getEnclosingClass(),
                         false);
    }

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineParameters.class);

}
