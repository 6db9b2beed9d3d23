package org.janelia.surfalign.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.FileSystems;
import java.nio.file.Path;

import org.janelia.surfalign.client.parameter.CommandLineParameters;
import org.janelia.surfalign.feature.FeatureSet;
import org.janelia.surfalign.feature.FlagSet;
import org.janelia.surfalign.parameters.RigidRegistrationParameters;
import org.janelia.surfalign.registration.RigidRegistration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for rigidly (or similarly) registering a floating feature set file onto a target feature set file.
 */
public class RigidRegistrationClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--floatingFeatures",
                description = "Feature set file (.json or .gz) for the features to move",
                required = true)
        public String floatingFeatures;

        @Parameter(
                names = "--targetFeatures",
                description = "Feature set file (.json or .gz) for the features to move onto",
                required = true)
        public String targetFeatures;

        @Parameter(
                names = "--floatingFlags",
                description = "Flag set file for the floating features (omit to treat all floating features as valid)")
        public String floatingFlags;

        @Parameter(
                names = "--targetFlags",
                description = "Flag set file for the target features (omit to treat all target features as valid)")
        public String targetFlags;

        @Parameter(
                names = "--outputFeatures",
                description = "File for the registered floating features")
        public String outputFeatures;

        @Parameter(
                names = "--outputTransform",
                description = "File for the accumulated similarity transform")
        public String outputTransform;

        @ParametersDelegate
        public RigidRegistrationParameters registration = new RigidRegistrationParameters();
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args, RigidRegistrationClient.class);

                LOG.info("runClient: entry, parameters={}", parameters);

                final RigidRegistrationClient client = new RigidRegistrationClient(parameters);
                client.register();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public RigidRegistrationClient(final Parameters parameters)
            throws IllegalArgumentException {
        parameters.registration.validate();
        this.parameters = parameters;
    }

    /**
     * Loads the feature and flag sets, registers the floating features onto the target features,
     * and saves any requested outputs.
     *
     * @return the registration result.
     *
     * @throws IOException
     *   if any file cannot be read or written.
     */
    public RigidRegistration.Result register()
            throws IOException {

        final FeatureSet floatingFeatures = loadFeatureSet(parameters.floatingFeatures);
        final FeatureSet targetFeatures = loadFeatureSet(parameters.targetFeatures);
        final FlagSet floatingFlags = loadFlagSet(parameters.floatingFlags, floatingFeatures.size());
        final FlagSet targetFlags = loadFlagSet(parameters.targetFlags, targetFeatures.size());

        final RigidRegistration registration = new RigidRegistration(parameters.registration);
        final RigidRegistration.Result result = registration.run(floatingFeatures,
                                                                 targetFeatures,
                                                                 floatingFlags,
                                                                 targetFlags);

        LOG.info("register: derived transform {}", result.getTransform());

        if (parameters.outputFeatures != null) {
            FileUtil.saveJsonFile(parameters.outputFeatures, result.getRegisteredFeatures());
        }

        if (parameters.outputTransform != null) {
            FileUtil.saveJsonFile(parameters.outputTransform, result.getTransform());
        }

        return result;
    }

    static FeatureSet loadFeatureSet(final String dataFile)
            throws IOException, IllegalArgumentException {

        final Path path = FileSystems.getDefault().getPath(dataFile).toAbsolutePath();

        LOG.info("loadFeatureSet: entry, path={}", path);

        final FeatureSet featureSet;
        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(path.toString())) {
            featureSet = FeatureSet.fromJson(reader);
        }

        LOG.info("loadFeatureSet: exit, loaded {}", featureSet);

        return featureSet;
    }

    /**
     * @return flags loaded from the specified file or all valid flags if no file is specified.
     */
    static FlagSet loadFlagSet(final String dataFile,
                               final int expectedSize)
            throws IOException, IllegalArgumentException {

        final FlagSet flagSet;

        if (dataFile == null) {
            flagSet = FlagSet.allValid(expectedSize);
        } else {
            final Path path = FileSystems.getDefault().getPath(dataFile).toAbsolutePath();
            LOG.info("loadFlagSet: entry, path={}", path);
            try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(path.toString())) {
                flagSet = FlagSet.fromJson(reader);
            }
        }

        if (flagSet.size() != expectedSize) {
            throw new IllegalArgumentException("loaded " + flagSet.size() + " flags from " + dataFile +
                                               " but expected " + expectedSize);
        }

        return flagSet;
    }

    private static final Logger LOG = LoggerFactory.getLogger(RigidRegistrationClient.class);
}
