package org.janelia.spmjobs.spmservices;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.hamcrest.MatcherAssert;
import org.janelia.spmjobs.frames.FrameEnumerator;
import org.janelia.spmjobs.frames.VolumeHeader;
import org.janelia.spmjobs.frames.VolumeReader;
import org.janelia.spmjobs.jobspec.JobNode;
import org.janelia.spmjobs.jobspec.JobNodes;
import org.janelia.spmjobs.jobspec.KeyedGroupNode;
import org.janelia.spmjobs.jobspec.MatlabJobScripts;
import org.janelia.spmjobs.jobspec.OrderedGroupNode;
import org.janelia.spmjobs.jobspec.ScalarNode;
import org.janelia.spmjobs.jobspec.StringArrayNode;
import org.janelia.spmjobs.options.OptionNormalizer;
import org.janelia.spmjobs.options.OptionSet;
import org.janelia.spmjobs.options.ValidationException;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class JobAssemblerTest {

    private JobAssembler jobAssembler;

    @Before
    public void setUp() {
        Logger logger = mock(Logger.class);
        VolumeReader volumeReader = mock(VolumeReader.class);
        when(volumeReader.open("/data/func.nii")).thenReturn(new VolumeHeader("/data/func.nii", 64, 64, 30, 3));
        when(volumeReader.open("/data/run2.nii")).thenReturn(new VolumeHeader("/data/run2.nii", 64, 64, 30, 2));
        when(volumeReader.open("/data/anat.nii")).thenReturn(new VolumeHeader("/data/anat.nii", 256, 256, 160));
        jobAssembler = new JobAssembler(new FrameEnumerator(volumeReader, logger), new OptionNormalizer(logger), logger);
    }

    private StringArrayNode funcFrames() {
        return StringArrayNode.of("/data/func.nii,1", "/data/func.nii,2", "/data/func.nii,3");
    }

    @Test
    public void realignWritesByDefault() {
        RealignOperation realign = new RealignOperation();
        OptionSet options = realign.newOptionSet()
                .set("infile", "/data/func.nii")
                .set("fwhm", 5)
                .set("separation", 4)
                .set("wrap", ImmutableList.of(0, 0, 1));

        AssembledJob job = jobAssembler.assemble(realign, options);

        MatcherAssert.assertThat(job.getVariant(), equalTo("estwrite"));
        MatcherAssert.assertThat(job.getRootPrefix(), equalTo("jobs{1}.spatial{1}.realign{1}"));
        MatcherAssert.assertThat(job.getContents(), equalTo(KeyedGroupNode.builder()
                .put("estwrite", KeyedGroupNode.builder()
                        .put("data", funcFrames())
                        .put("eoptions", (KeyedGroupNode) JobNodes.fromObject(ImmutableMap.of(
                                "fwhm", 5.0,
                                "sep", 4.0,
                                "wrap", ImmutableList.of(0, 0, 1))))
                        .put("roptions", KeyedGroupNode.empty())
                        .build())
                .build()));
        MatcherAssert.assertThat(job.getInputFiles(), equalTo(ImmutableList.of("/data/func.nii")));
        MatcherAssert.assertThat(job.getExpectedOutputs(), equalTo(ImmutableList.of("/data/rfunc.nii")));
        MatcherAssert.assertThat(job.getUnsupportedOptions(), empty());
    }

    @Test
    public void realignEstimateOnly() {
        RealignOperation realign = new RealignOperation();
        OptionSet options = realign.newOptionSet()
                .set("infile", "/data/func.nii")
                .set("write", false)
                .set("write_mask", 1);

        AssembledJob job = jobAssembler.assemble(realign, options);

        MatcherAssert.assertThat(job.getVariant(), equalTo("estimate"));
        KeyedGroupNode estimate = job.getContents().getGroup("estimate").orElseThrow();
        MatcherAssert.assertThat(ImmutableList.copyOf(estimate.keys()), equalTo(ImmutableList.of("data", "eoptions")));
        MatcherAssert.assertThat(job.getExpectedOutputs(), equalTo(ImmutableList.of("/data/func.nii")));
    }

    @Test
    public void multipleInputsAreSessions() {
        RealignOperation realign = new RealignOperation();
        OptionSet options = realign.newOptionSet()
                .set("infile", ImmutableList.of("/data/func.nii", "/data/run2.nii"));

        AssembledJob job = jobAssembler.assemble(realign, options);

        JobNode data = job.getContents().getGroup("estwrite").flatMap(g -> g.get("data")).orElseThrow();
        MatcherAssert.assertThat(data, equalTo(OrderedGroupNode.of(
                funcFrames(),
                StringArrayNode.of("/data/run2.nii,1", "/data/run2.nii,2"))));
        MatcherAssert.assertThat(job.getExpectedOutputs(), equalTo(ImmutableList.of("/data/rfunc.nii", "/data/rrun2.nii")));

        String script = new MatlabJobScripts().createJobScript(job.getFamily(), job.getName(), job.getContents()).getText();
        MatcherAssert.assertThat(script, containsString("jobs{1}.spatial{1}.realign{1}.estwrite.data(1) = {...\n'/data/func.nii,1';...\n"));
        MatcherAssert.assertThat(script, containsString("jobs{1}.spatial{1}.realign{1}.estwrite.data(2) = {...\n'/data/run2.nii,1';...\n"));
    }

    @Test
    public void missingInputFile() {
        RealignOperation realign = new RealignOperation();
        ValidationException e = assertThrows(ValidationException.class, () -> jobAssembler.assemble(realign, realign.newOptionSet()));
        MatcherAssert.assertThat(e.getOptionName(), equalTo("infile"));
    }

    @Test
    public void coregister() {
        CoregisterOperation coreg = new CoregisterOperation();
        OptionSet options = coreg.newOptionSet()
                .set("target", "/data/mean.nii")
                .set("source", "/data/anat.nii")
                .set("infile", "/data/func.nii")
                .set("cost_function", "nmi");

        AssembledJob job = jobAssembler.assemble(coreg, options);

        KeyedGroupNode estwrite = job.getContents().getGroup("estwrite").orElseThrow();
        MatcherAssert.assertThat(ImmutableList.copyOf(estwrite.keys()), equalTo(ImmutableList.of("ref", "source", "other", "eoptions", "roptions")));
        MatcherAssert.assertThat(estwrite.get("ref").orElseThrow(), equalTo(ScalarNode.of("/data/mean.nii")));
        MatcherAssert.assertThat(estwrite.get("source").orElseThrow(), equalTo(ScalarNode.of("/data/anat.nii")));
        MatcherAssert.assertThat(estwrite.get("other").orElseThrow(), equalTo(funcFrames()));
        MatcherAssert.assertThat(estwrite.getGroup("eoptions").flatMap(g -> g.get("cost_fun")).orElseThrow(), equalTo(ScalarNode.of("nmi")));
        MatcherAssert.assertThat(job.getExpectedOutputs(), equalTo(ImmutableList.of("/data/ranat.nii", "/data/rfunc.nii")));
    }

    @Test
    public void coregisterRequiresTargetAndSource() {
        CoregisterOperation coreg = new CoregisterOperation();
        OptionSet options = coreg.newOptionSet()
                .set("source", "/data/anat.nii")
                .set("infile", "/data/func.nii");
        ValidationException e = assertThrows(ValidationException.class, () -> jobAssembler.assemble(coreg, options));
        MatcherAssert.assertThat(e.getOptionName(), equalTo("target"));
    }

    @Test
    public void coregisterToleranceHasTwelveElements() {
        CoregisterOperation coreg = new CoregisterOperation();
        OptionSet options = coreg.newOptionSet()
                .set("target", "/data/mean.nii")
                .set("source", "/data/anat.nii")
                .set("infile", "/data/func.nii")
                .set("tolerance", ImmutableList.of(0.02, 0.02, 0.02));
        ValidationException e = assertThrows(ValidationException.class, () -> jobAssembler.assemble(coreg, options));
        MatcherAssert.assertThat(e.getMessage(), containsString("12 elements"));
    }

    @Test
    public void normaliseEstimateOnly() {
        NormalizeOperation normalise = new NormalizeOperation();
        OptionSet options = normalise.newOptionSet()
                .set("infile", "/data/func.nii")
                .set("source", "/data/anat.nii")
                .set("template", "/spm/templates/T1.nii")
                .set("write", false);

        AssembledJob job = jobAssembler.assemble(normalise, options);

        MatcherAssert.assertThat(job.getVariant(), equalTo("est"));
        KeyedGroupNode est = job.getContents().getGroup("est").orElseThrow();
        MatcherAssert.assertThat(ImmutableList.copyOf(est.keys()), equalTo(ImmutableList.of("subj", "eoptions")));
        MatcherAssert.assertThat(est.getGroup("subj").orElseThrow(), equalTo(KeyedGroupNode.builder()
                .put("source", ScalarNode.of("/data/anat.nii"))
                .put("resample", funcFrames())
                .build()));
        MatcherAssert.assertThat(est.getGroup("eoptions").flatMap(g -> g.get("template")).orElseThrow(), equalTo(ScalarNode.of("/spm/templates/T1.nii")));
    }

    @Test
    public void normaliseWritesWarpedImages() {
        NormalizeOperation normalise = new NormalizeOperation();
        OptionSet options = normalise.newOptionSet()
                .set("infile", "/data/func.nii")
                .set("source", "/data/anat.nii")
                .set("write_voxel_sizes", ImmutableList.of(2, 2, 2));

        AssembledJob job = jobAssembler.assemble(normalise, options);

        MatcherAssert.assertThat(job.getVariant(), equalTo("estwrite"));
        MatcherAssert.assertThat(job.getExpectedOutputs(), equalTo(ImmutableList.of("/data/wfunc.nii")));
    }

    @Test
    public void normaliseRequiresSource() {
        NormalizeOperation normalise = new NormalizeOperation();
        OptionSet options = normalise.newOptionSet().set("infile", "/data/func.nii");
        ValidationException e = assertThrows(ValidationException.class, () -> jobAssembler.assemble(normalise, options));
        MatcherAssert.assertThat(e.getOptionName(), equalTo("source"));
    }

    @Test
    public void smoothHasNoVariant() {
        SmoothOperation smooth = new SmoothOperation();
        OptionSet options = smooth.newOptionSet()
                .set("infile", "/data/anat.nii")
                .set("fwhm", ImmutableList.of(8, 8, 8));

        AssembledJob job = jobAssembler.assemble(smooth, options);

        MatcherAssert.assertThat(job.getVariant(), nullValue());
        MatcherAssert.assertThat(job.getContents(), equalTo(KeyedGroupNode.builder()
                .put("data", StringArrayNode.of("/data/anat.nii,1"))
                .put("fwhm", OrderedGroupNode.of(ScalarNode.of(8.0), ScalarNode.of(8.0), ScalarNode.of(8.0)))
                .put("dtype", ScalarNode.of(0))
                .build()));
        MatcherAssert.assertThat(job.getExpectedOutputs(), equalTo(ImmutableList.of("/data/sanat.nii")));
    }

    @Test
    public void smoothIgnoresTheWriteSwitch() {
        SmoothOperation smooth = new SmoothOperation();
        OptionSet options = smooth.newOptionSet()
                .set("infile", "/data/anat.nii")
                .set("write", false);

        AssembledJob job = jobAssembler.assemble(smooth, options);

        MatcherAssert.assertThat(job.getUnsupportedOptions(), equalTo(ImmutableList.of("write")));
        MatcherAssert.assertThat(job.getExpectedOutputs(), equalTo(ImmutableList.of("/data/sanat.nii")));
    }
}
