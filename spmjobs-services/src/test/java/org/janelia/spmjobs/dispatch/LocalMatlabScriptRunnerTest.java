package org.janelia.spmjobs.dispatch;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import org.hamcrest.MatcherAssert;
import org.janelia.spmjobs.config.ApplicationConfig;
import org.janelia.spmjobs.config.ApplicationConfigImpl;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.slf4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.mock;

public class LocalMatlabScriptRunnerTest {

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    private ApplicationConfig applicationConfig;
    private LocalMatlabScriptRunner scriptRunner;

    @Before
    public void setUp() {
        applicationConfig = new ApplicationConfigImpl();
        scriptRunner = new LocalMatlabScriptRunner(applicationConfig, mock(Logger.class));
    }

    @Test
    public void wrapperRunsTheScriptAndExits() {
        MatcherAssert.assertThat(scriptRunner.createWrapper("spmjobs_script"), equalTo(
                "try, spmjobs_script; catch err, disp(getReport(err, 'basic')); exit(1); end; exit(0);"));
    }

    @Test
    public void wrapperAddsTheConfiguredSpmPath() {
        applicationConfig.put("SPM.Path", "/opt/spm12");
        MatcherAssert.assertThat(scriptRunner.createWrapper("spmjobs_script"), equalTo(
                "addpath('/opt/spm12'); try, spmjobs_script; catch err, disp(getReport(err, 'basic')); exit(1); end; exit(0);"));
    }

    @Test
    public void commandFromConfiguration() {
        applicationConfig.put("Matlab.Cmd", "/usr/local/bin/matlab");
        applicationConfig.put("Matlab.Args", " -nodesktop  -nosplash ");
        MatcherAssert.assertThat(scriptRunner.createCommand("job"), equalTo(ImmutableList.of(
                "/usr/local/bin/matlab",
                "-nodesktop",
                "-nosplash",
                "-r",
                "try, job; catch err, disp(getReport(err, 'basic')); exit(1); end; exit(0);")));
    }

    @Test
    public void runSavesTheScriptAndCapturesTheOutput() throws IOException {
        applicationConfig.put("Matlab.Cmd", "echo");
        File workingDir = testFolder.newFolder("job");

        ScriptExecution execution = scriptRunner.runScript("spm_jobman('run',jobs);\n", workingDir.toPath(), "spmjobs_script");

        MatcherAssert.assertThat(execution.getExitCode(), equalTo(0));
        MatcherAssert.assertThat(execution.getOutput(), containsString("try, spmjobs_script;"));
        MatcherAssert.assertThat(execution.getCommandLine(), containsString("echo -r"));
        MatcherAssert.assertThat(Files.asCharSource(new File(workingDir, "spmjobs_script.m"), StandardCharsets.UTF_8).read(),
                equalTo("spm_jobman('run',jobs);\n"));
    }

    @Test
    public void launchFailure() {
        applicationConfig.put("Matlab.Cmd", "/nonexistent/bin/matlab");
        DispatchException e = assertThrows(DispatchException.class,
                () -> scriptRunner.runScript("x = 1;\n", testFolder.getRoot().toPath(), "spmjobs_script"));
        MatcherAssert.assertThat(e.getExitCode(), equalTo(-1));
        MatcherAssert.assertThat(e.getCommandLine(), containsString("/nonexistent/bin/matlab"));
    }
}
