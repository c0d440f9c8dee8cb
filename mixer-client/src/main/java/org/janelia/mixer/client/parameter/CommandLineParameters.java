package org.janelia.mixer.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.janelia.mixer.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base parameters for all mixer command line tools.
 *
 * Subclasses declare their options with JCommander annotations and override {@link #validate}
 * for checks that span more than one option.
 */
@Parameters
public class CommandLineParameters implements Serializable {

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help;

    public CommandLineParameters() {
        this.help = false;
    }

    /**
     * Parses the arguments for the tool that encloses this parameters class,
     * exiting the process if help is requested or the arguments are invalid.
     */
    public void parse(final String[] args) {
        parse(args, this.getClass().getEnclosingClass(), true);
    }

    /**
     * @param  args                 command line arguments.
     * @param  programClass         tool class (for usage output).
     * @param  exitOnHelpOrFailure  indicates whether the process should exit after printing usage.
     *
     * @return true if the arguments were parsed and validated and help was not requested.
     */
    public boolean parse(final String[] args,
                         final Class<?> programClass,
                         final boolean exitOnHelpOrFailure) {

        final JCommander jCommander = JCommander.newBuilder()
                .addObject(this)
                .programName("java -cp mixer-client-standalone.jar " + programClass.getName())
                .build();

        String failureMessage = null;
        try {
            jCommander.parse(args);
            if (! help) {
                validate();
            }
        } catch (final ParameterException | IllegalArgumentException e) {
            failureMessage = e.getMessage();
        }

        final boolean usable = (failureMessage == null) && (! help);

        if (! usable) {
            if (failureMessage != null) {
                LOG.warn("parse: invalid arguments for {}, {}", programClass.getSimpleName(), failureMessage);
                JCommander.getConsole().println("\nERROR: " + failureMessage + "\n");
            }
            jCommander.usage();
            if (exitOnHelpOrFailure) {
                System.exit(1);
            }
        }

        return usable;
    }

    /**
     * Called after a successful parse.
     *
     * @throws IllegalArgumentException
     *   if the parsed option values cannot be used together.
     */
    protected void validate()
            throws IllegalArgumentException {
    }

    @Override
    public String toString() {
        try {
            return JsonUtils.MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /**
     * Prints usage for the parameters without exiting (used by tests to verify option declarations).
     */
    public static void parseHelp(final CommandLineParameters parameters) {
        parameters.parse(new String[] { "--help" }, parameters.getClass().getEnclosingClass(), false);
    }

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineParameters.class);
}
