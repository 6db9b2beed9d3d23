package org.janelia.surfalign.client;

import java.io.File;
import java.io.IOException;
import java.io.Reader;

import org.janelia.surfalign.client.parameter.CommandLineParameters;
import org.janelia.surfalign.feature.FeatureSet;
import org.janelia.surfalign.feature.FlagSet;
import org.janelia.surfalign.registration.RigidRegistration;
import org.janelia.surfalign.transform.SimilarityTransform;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link RigidRegistrationClient} class.
 */
public class RigidRegistrationClientTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new RigidRegistrationClient.Parameters());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingRequiredParameter() {
        new RigidRegistrationClient.Parameters().parse(new String[] {"--targetFeatures", "target.json"},
                                                       RigidRegistrationClient.class,
                                                       false);
    }

    @Test
    public void testRegistrationWithFiles() throws Exception {

        final FeatureSet floating = buildStackedCircle();
        final FeatureSet target = floating.copy();
        final double[][] rotation = {{0, -1, 0}, {1, 0, 0}, {0, 0, 1}};
        new SimilarityTransform(1.0, rotation, new double[] {0, 0, 0}).applyToFeatures(target);

        final File floatingFile = temporaryFolder.newFile("floating.json");
        final File targetFile = new File(temporaryFolder.getRoot(), "target.json.gz");
        final File targetFlagsFile = temporaryFolder.newFile("target-flags.json");
        FileUtil.saveJsonFile(floatingFile.getAbsolutePath(), floating);
        FileUtil.saveJsonFile(targetFile.getAbsolutePath(), target);
        FileUtil.saveJsonFile(targetFlagsFile.getAbsolutePath(), FlagSet.allValid(4));

        final File outputFeaturesFile = new File(temporaryFolder.getRoot(), "registered.json");
        final File outputTransformFile = new File(temporaryFolder.getRoot(), "transform.json");

        final String[] args = {
                "--floatingFeatures", floatingFile.getAbsolutePath(),
                "--targetFeatures", targetFile.getAbsolutePath(),
                "--targetFlags", targetFlagsFile.getAbsolutePath(),
                "--outputFeatures", outputFeaturesFile.getAbsolutePath(),
                "--outputTransform", outputTransformFile.getAbsolutePath(),
                "--numNeighbors", "2",
                "--numIterations", "10"
        };

        final RigidRegistrationClient.Parameters parameters = new RigidRegistrationClient.Parameters();
        parameters.parse(args, RigidRegistrationClient.class, false);

        Assert.assertNull("floating flags should not be set", parameters.floatingFlags);
        Assert.assertEquals("invalid numNeighbors", 2, parameters.registration.correspondence.numNeighbors);
        Assert.assertTrue("parameters should render as JSON", parameters.toString().contains("\"numIterations\""));

        final RigidRegistration.Result result = new RigidRegistrationClient(parameters).register();
        Assert.assertEquals("invalid number of iterations", 10, result.getIterations());

        Assert.assertTrue("registered features not saved", outputFeaturesFile.exists());
        Assert.assertTrue("transform not saved", outputTransformFile.exists());

        final FeatureSet registered = RigidRegistrationClient.loadFeatureSet(outputFeaturesFile.getAbsolutePath());
        for (int i = 0; i < registered.size(); i++) {
            Assert.assertArrayEquals("registered position " + i + " should match target",
                                     target.getPosition(i), registered.getPosition(i), 1e-5);
        }

        final SimilarityTransform transform;
        try (final Reader reader =
                     FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(outputTransformFile.getAbsolutePath())) {
            transform = SimilarityTransform.fromJson(reader);
        }
        final double[][] parsedRotation = transform.getRotation();
        for (int row = 0; row < 3; row++) {
            Assert.assertArrayEquals("invalid rotation row " + row, rotation[row], parsedRotation[row], 1e-5);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFlagCountMismatch() throws IOException {
        final File flagsFile = temporaryFolder.newFile("flags.json");
        FileUtil.saveJsonFile(flagsFile.getAbsolutePath(), FlagSet.allValid(3));
        RigidRegistrationClient.loadFlagSet(flagsFile.getAbsolutePath(), 4);
    }

    private static FeatureSet buildStackedCircle() {
        final double[][] features = new double[4][];
        for (int i = 0; i < features.length; i++) {
            final double angle = i * Math.PI / 2.0;
            features[i] = new double[] {Math.cos(angle), Math.sin(angle), 10.0 * i, 0.0, 0.0, 1.0};
        }
        return new FeatureSet(features);
    }

}
