package org.broadinstitute.mutator.tools.mutation;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.RuntimeIOException;
import htsjdk.variant.variantcontext.Allele;
import htsjdk.variant.variantcontext.Genotype;
import htsjdk.variant.variantcontext.GenotypeBuilder;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.variantcontext.VariantContextBuilder;
import htsjdk.variant.variantcontext.writer.Options;
import htsjdk.variant.variantcontext.writer.VariantContextWriter;
import htsjdk.variant.variantcontext.writer.VariantContextWriterBuilder;
import htsjdk.variant.vcf.VCFConstants;
import htsjdk.variant.vcf.VCFHeader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.mutator.exceptions.UserException;
import org.broadinstitute.mutator.utils.SimpleInterval;
import org.broadinstitute.mutator.utils.Utils;
import org.broadinstitute.mutator.utils.collections.GenomicIntervalMap;
import org.broadinstitute.mutator.utils.config.ConfigFactory;
import org.broadinstitute.mutator.utils.config.MutatorConfig;
import org.broadinstitute.mutator.utils.variant.MutatorVCFConstants;
import org.broadinstitute.mutator.utils.variant.MutatorVCFHeaderLines;
import org.broadinstitute.mutator.utils.variant.SimpleVariant;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Writes a finished overlay as a single-sample GVCF, one record per stored interval.
 *
 * Every record gets a diploid homozygous genotype: reference for {@code <NON_REF>} blocks, the first alternate
 * allele otherwise.
 */
public final class MutatedGVCFWriter {
    private static final Logger logger = LogManager.getLogger(MutatedGVCFWriter.class);

    private static final String SOURCE = "MutateAssemblies";

    private final String outputSuffix;
    private final String outputExtension;
    private final boolean createMD5;

    /**
     * Writer using the output naming and MD5 settings of {@link MutatorConfig}.
     */
    public MutatedGVCFWriter() {
        this(ConfigFactory.getInstance().getMutatorConfig());
    }

    public MutatedGVCFWriter(final MutatorConfig config) {
        this(Utils.nonNull(config, "config").outputSuffix(), config.outputExtension(), config.createOutputMd5());
    }

    public MutatedGVCFWriter(final String outputSuffix, final String outputExtension, final boolean createMD5) {
        this.outputSuffix = Utils.nonNull(outputSuffix, "outputSuffix");
        this.outputExtension = Utils.nonEmpty(outputExtension, "outputExtension");
        this.createMD5 = createMD5;
    }

    /**
     * @return the file {@link #write} creates for {@code sampleName} under {@code outputDir}
     */
    public Path getOutputPath(final Path outputDir, final String sampleName) {
        return outputDir.resolve(sampleName + outputSuffix + outputExtension);
    }

    /**
     * Writes {@code variants} in iteration order to {@code <outputDir>/<sampleName><suffix><extension>},
     * creating {@code outputDir} if needed. The file is closed on every exit path.
     *
     * @return the path of the written file
     */
    public Path write(final Path outputDir, final String sampleName, final GenomicIntervalMap<SimpleVariant> variants) {
        Utils.nonNull(outputDir, "outputDir");
        Utils.nonEmpty(sampleName, "sampleName");
        Utils.nonNull(variants, "variants");

        try {
            Files.createDirectories(outputDir);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(outputDir, "the output directory could not be created", e);
        }

        final Path outputPath = getOutputPath(outputDir, sampleName);
        final VCFHeader header = MutatorVCFHeaderLines.createGenericHeader(Collections.singletonList(sampleName), Collections.emptyList());
        int written = 0;
        try (final VariantContextWriter writer = createVCFWriter(outputPath)) {
            writer.writeHeader(header);
            for (final Map.Entry<SimpleInterval, SimpleVariant> entry : variants.entries()) {
                writer.add(toVariantContext(sampleName, entry.getKey(), entry.getValue()));
                written++;
            }
        } catch (final RuntimeIOException | IllegalStateException | IllegalArgumentException e) {
            throw new UserException.CouldNotCreateOutputFile(outputPath, "writing records failed", e);
        }
        logger.info("Wrote {} record(s) for sample {} to {}", written, sampleName, outputPath);
        return outputPath;
    }

    private VariantContextWriter createVCFWriter(final Path outputPath) {
        final VariantContextWriterBuilder builder = new VariantContextWriterBuilder()
                .clearOptions()
                .setOutputPath(outputPath)
                .setOption(Options.ALLOW_MISSING_FIELDS_IN_HEADER);

        if (VariantContextWriterBuilder.OutputType.UNSPECIFIED == VariantContextWriterBuilder.determineOutputTypeFromFile(outputPath)) {
            builder.setOutputFileType(VariantContextWriterBuilder.OutputType.VCF);
        }
        if (createMD5) {
            builder.setCreateMD5();
        }
        return builder.build();
    }

    /**
     * Converts one stored call back to a record. END is always written so that blocks keep their extent.
     */
    @VisibleForTesting
    static VariantContext toVariantContext(final String sampleName, final SimpleInterval interval, final SimpleVariant variant) {
        final Allele reference = Allele.create(variant.getReferenceAllele(), true);
        final List<Allele> alleles = new ArrayList<>();
        alleles.add(reference);
        for (final String alternate : variant.getAlternateAllele().split(MutatorVCFConstants.ALT_ALLELE_SEPARATOR)) {
            alleles.add(Allele.create(alternate, false));
        }

        final Allele called = MutatorVCFConstants.NON_REF_SYMBOLIC_ALLELE.equals(variant.getAlternateAllele()) ? reference : alleles.get(1);
        final Genotype genotype = new GenotypeBuilder(sampleName, Arrays.asList(called, called)).make();

        final VariantContextBuilder builder = new VariantContextBuilder(SOURCE, interval.getContig(), interval.getStart(), interval.getEnd(), alleles)
                .noID()
                .attribute(VCFConstants.END_KEY, interval.getEnd())
                .genotypes(genotype);
        for (final Map.Entry<String, Object> annotation : variant.getAssemblyAnnotations().entrySet()) {
            builder.attribute(annotation.getKey(), annotation.getValue());
        }
        return builder.make();
    }
}
