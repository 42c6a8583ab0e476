package org.janelia.spmjobs.dispatch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.hamcrest.MatcherAssert;
import org.janelia.spmjobs.cdi.ObjectMapperFactory;
import org.janelia.spmjobs.frames.FrameEnumerator;
import org.janelia.spmjobs.frames.VolumeHeader;
import org.janelia.spmjobs.frames.VolumeReader;
import org.janelia.spmjobs.options.OptionNormalizer;
import org.janelia.spmjobs.spmservices.AssembledJob;
import org.janelia.spmjobs.spmservices.JobAssembler;
import org.janelia.spmjobs.spmservices.SmoothOperation;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class JobDispatcherTest {

    private static final String TEST_COMMAND_LINE = "matlab -nodesktop -nosplash -r spmjobs_script";

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    private MatlabScriptRunner scriptRunner;
    private ObjectMapper objectMapper;
    private JobDispatcher jobDispatcher;
    private AssembledJob smoothJob;

    @Before
    public void setUp() {
        Logger logger = mock(Logger.class);
        scriptRunner = mock(MatlabScriptRunner.class);
        objectMapper = ObjectMapperFactory.instance().newObjectMapper();
        jobDispatcher = new JobDispatcher(scriptRunner, new MatlabErrorChecker(logger), objectMapper, null, "", logger);

        VolumeReader volumeReader = mock(VolumeReader.class);
        when(volumeReader.open("/data/anat.nii")).thenReturn(new VolumeHeader("/data/anat.nii", 256, 256, 160));
        JobAssembler jobAssembler = new JobAssembler(new FrameEnumerator(volumeReader, logger), new OptionNormalizer(logger), logger);
        SmoothOperation smooth = new SmoothOperation();
        smoothJob = jobAssembler.assemble(smooth, smooth.newOptionSet()
                .set("infile", "/data/anat.nii")
                .set("fwhm", ImmutableList.of(6, 6, 6)));
    }

    @Test
    public void dispatchScript() {
        Path workingDir = testFolder.getRoot().toPath();
        when(scriptRunner.runScript(anyString(), any(Path.class), anyString()))
                .thenReturn(new ScriptExecution("Done    'Smooth'\n", "", TEST_COMMAND_LINE, 0));

        JobOutcome outcome = jobDispatcher.dispatch(smoothJob, DispatchMode.SCRIPT, workingDir);

        verify(scriptRunner).runScript(eq(jobDispatcher.createScript(smoothJob)), eq(workingDir), eq("spmjobs_script"));
        MatcherAssert.assertThat(outcome.getMode(), equalTo(DispatchMode.SCRIPT));
        MatcherAssert.assertThat(outcome.getJobFile(), equalTo(workingDir.resolve("spmjobs_script.m")));
        MatcherAssert.assertThat(outcome.getOutputFiles(), contains("/data/sanat.nii"));
        MatcherAssert.assertThat(outcome.getExecution().getExitCode(), equalTo(0));
    }

    @Test
    public void generatedScriptRunsTheJob() {
        String script = jobDispatcher.createScript(smoothJob);
        MatcherAssert.assertThat(script, containsString("jobs{1}.spatial{1}.smooth{1}.data = {...\n'/data/anat.nii,1';...\n};\n"));
        MatcherAssert.assertThat(script, containsString("jobs{1}.spatial{1}.smooth{1}.fwhm(3) = 6.0;\n"));
        MatcherAssert.assertThat(script, containsString("jobs{1}.spatial{1}.smooth{1}.dtype = 0;\n"));
        MatcherAssert.assertThat(script, containsString("spm_jobman('run',jobs);\n"));
    }

    @Test
    public void dispatchStructure() throws IOException {
        Path workingDir = testFolder.getRoot().toPath();
        when(scriptRunner.runScript(anyString(), any(Path.class), anyString()))
                .thenReturn(new ScriptExecution("", "", TEST_COMMAND_LINE, 0));

        JobOutcome outcome = jobDispatcher.dispatch(smoothJob, DispatchMode.STRUCTURE, workingDir);

        verify(scriptRunner).runScript(
                eq("spmjob = jsondecode(fileread('spmjobs.json'));\nspm_jobman('run', spmjob.jobs);\n"),
                eq(workingDir),
                eq("spmjobs_script"));
        MatcherAssert.assertThat(outcome.getJobFile(), equalTo(workingDir.resolve("spmjobs.json")));
        Map<String, Object> jobStructure = objectMapper.readValue(outcome.getJobFile().toFile(), new TypeReference<Map<String, Object>>() {});
        MatcherAssert.assertThat(jobStructure, equalTo(ImmutableMap.of("jobs", ImmutableList.of(
                ImmutableMap.of("spatial", ImmutableList.of(
                        ImmutableMap.of("smooth", ImmutableList.of(
                                ImmutableMap.of(
                                        "data", ImmutableList.of("/data/anat.nii,1"),
                                        "fwhm", ImmutableList.of(6.0, 6.0, 6.0),
                                        "dtype", 0)))))))));
    }

    @Test
    public void abnormalExitIsAFailure() {
        when(scriptRunner.runScript(anyString(), any(Path.class), anyString()))
                .thenReturn(new ScriptExecution("", "", TEST_COMMAND_LINE, 1));

        DispatchException e = assertThrows(DispatchException.class,
                () -> jobDispatcher.dispatch(smoothJob, DispatchMode.SCRIPT, testFolder.getRoot().toPath()));
        MatcherAssert.assertThat(e.getExitCode(), equalTo(1));
        MatcherAssert.assertThat(e.getCommandLine(), equalTo(TEST_COMMAND_LINE));
    }

    @Test
    public void errorOutputIsAFailure() {
        when(scriptRunner.runScript(anyString(), any(Path.class), anyString()))
                .thenReturn(new ScriptExecution(
                        "Running job #1\nError using spm_jobman\nJob execution failed.\n",
                        "",
                        TEST_COMMAND_LINE,
                        0));

        DispatchException e = assertThrows(DispatchException.class,
                () -> jobDispatcher.dispatch(smoothJob, DispatchMode.SCRIPT, testFolder.getRoot().toPath()));
        MatcherAssert.assertThat(e.getErrors(), contains("Error using spm_jobman"));
        MatcherAssert.assertThat(e.getMessage(), containsString("Error using spm_jobman"));
    }

    @Test
    public void launchFailurePropagates() {
        when(scriptRunner.runScript(anyString(), any(Path.class), anyString()))
                .thenThrow(new DispatchException("Error running matlab", "matlab", new IOException("No such file")));

        DispatchException e = assertThrows(DispatchException.class,
                () -> jobDispatcher.dispatch(smoothJob, DispatchMode.SCRIPT, testFolder.getRoot().toPath()));
        MatcherAssert.assertThat(e.getExitCode(), equalTo(-1));
    }
}
