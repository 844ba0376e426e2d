package org.broadinstitute.mutator.tools.mutation;

import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.vcf.VCFFileReader;
import org.aeonbits.owner.ConfigCache;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.mutator.Main;
import org.broadinstitute.mutator.MutatorBaseTest;
import org.broadinstitute.mutator.exceptions.UserException;
import org.broadinstitute.mutator.utils.config.MutatorConfig;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class MutateAssembliesIntegrationTest extends MutatorBaseTest {

    private Object runTool(final String... args) {
        final List<String> argv = new ArrayList<>();
        argv.add(MutateAssemblies.class.getSimpleName());
        argv.addAll(Arrays.asList(args));
        return new Main().instanceMain(argv.toArray(new String[0]));
    }

    private Object runTool(final File founder, final File donor, final File outputDir, final String... extraArgs) {
        final List<String> args = new ArrayList<>(Arrays.asList(
                "--founder-gvcf", founder.getAbsolutePath(),
                "--non-founder-gvcf", donor.getAbsolutePath(),
                "--output-dir", outputDir.getAbsolutePath(),
                "--QUIET"));
        args.addAll(Arrays.asList(extraArgs));
        return runTool(args.toArray(new String[0]));
    }

    private static List<String> describe(final Path gvcf) {
        final List<String> records = new ArrayList<>();
        try (final VCFFileReader reader = new VCFFileReader(gvcf, false)) {
            for (final VariantContext vc : reader) {
                records.add(String.format("%s:%d-%d %s>%s %s", vc.getContig(), vc.getStart(), vc.getEnd(),
                        vc.getReference().getDisplayString(), vc.getAlternateAllele(0).getDisplayString(),
                        vc.getGenotype(0).getGenotypeString()));
            }
        }
        return records;
    }

    @Test
    public void testMutateAssemblies() {
        final File outputDir = new File(createTempDir("mutateAssemblies"), "out");
        final Object result = runTool(getTestFile("founder.g.vcf"), getTestFile("donor.g.vcf"), outputDir);

        final Path expectedOutput = outputDir.toPath().resolve("LineA_mutated.g.vcf");
        Assert.assertEquals(result, expectedOutput);
        Assert.assertEquals(describe(expectedOutput), Arrays.asList(
                "chr1:1-4 A><NON_REF> A/A",
                "chr1:5-5 A>G G/G",
                "chr1:6-9 A><NON_REF> A/A",
                "chr1:10-10 C>A A/A",
                "chr1:11-30 G><NON_REF> G/G",
                "chr1:31-34 ACGT>A A/A",
                "chr1:35-39 T><NON_REF> T/T",
                "chr1:40-40 T>TA TA/TA",
                "chr1:41-100 T><NON_REF> T/T",
                "chr2:1-9 G><NON_REF> G/G",
                "chr2:10-10 G>C C/C",
                "chr2:11-50 G><NON_REF> G/G"));
    }

    @Test
    public void testFounderAnnotationsAreKept() {
        final File outputDir = createTempDir("annotations");
        final Path output = (Path) runTool(getTestFile("founder.g.vcf"), getTestFile("founder.g.vcf"), outputDir);
        try (final VCFFileReader reader = new VCFFileReader(output, false)) {
            for (final VariantContext vc : reader) {
                if (vc.getStart() == 10) {
                    Assert.assertEquals(vc.getAttributeAsString("ASM_Chr", null), "ctg1");
                    Assert.assertEquals(vc.getAttributeAsString("ASM_Strand", null), "+");
                }
            }
        }
    }

    @Test
    public void testConfigFileChangesOutputName() throws IOException {
        final File configFile = createTempFile("mutatorConfig", ".properties");
        Files.write(configFile.toPath(), Arrays.asList("mutator.output.suffix = _custom"), StandardCharsets.UTF_8);
        final File outputDir = createTempDir("configured");
        try {
            final Object result = runTool(getTestFile("founder.g.vcf"), getTestFile("donor.g.vcf"), outputDir,
                    "--mutator-config-file", configFile.getAbsolutePath());
            Assert.assertEquals(result, outputDir.toPath().resolve("LineA_custom.g.vcf"));
        } finally {
            org.aeonbits.owner.ConfigFactory.setProperty(MutatorConfig.CONFIG_FILE_VARIABLE_FILE_NAME, "/dev/null");
            ConfigCache.remove(MutatorConfig.class);
        }
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testFounderWithoutSamples() {
        runTool(getTestFile("noSamples.g.vcf"), getTestFile("donor.g.vcf"), createTempDir("noSamples"));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testFounderWithTwoSamples() {
        runTool(getTestFile("twoSamples.g.vcf"), getTestFile("donor.g.vcf"), createTempDir("twoSamples"));
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingDonor() {
        runTool(getTestFile("founder.g.vcf"), getSafeNonExistentFile("donor.g.vcf"), createTempDir("missing"));
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testMalformedDonor() {
        runTool(getTestFile("founder.g.vcf"), getTestFile("malformed.g.vcf"), createTempDir("malformed"));
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testMissingRequiredArgument() {
        runTool("--founder-gvcf", getTestFile("founder.g.vcf").getAbsolutePath());
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testOutputDirIsAFile() {
        runTool(getTestFile("founder.g.vcf"), getTestFile("donor.g.vcf"), createTempFile("notADir", ".txt"));
    }

    @Test(expectedExceptions = UserException.class)
    public void testUnknownTool() {
        new Main().instanceMain(new String[]{"NoSuchTool"});
    }

    @Test
    public void testHelpReturnsWithoutRunning() {
        Assert.assertEquals(runTool("--help"), 0);
        Assert.assertNull(new Main().instanceMain(new String[]{}));
    }
}
