package org.janelia.spmjobs.jobspec;

import com.google.common.collect.ImmutableList;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the two forms of an SPM job: the MATLAB script that assigns the <code>jobs</code> variable and runs it,
 * and the equivalent structure <code>{jobs: [{family: [{name: [contents]}]}]}</code>.
 */
public class MatlabJobScripts {
    public static final String JOBS_VAR = "jobs";
    static final String SCRIPT_HEADER = "generated by spmjobs";

    private final JobScriptSerializer serializer;

    public MatlabJobScripts() {
        this(new JobScriptSerializer());
    }

    public MatlabJobScripts(JobScriptSerializer serializer) {
        this.serializer = serializer;
    }

    public static String rootPrefix(String family, String name) {
        return String.format("%s{1}.%s{1}.%s{1}", JOBS_VAR, family, name);
    }

    public JobScript createJobScript(String family, String name, JobNode contents) {
        String rootPrefix = rootPrefix(family, name);
        MatlabCodeBlock scriptCode = new MatlabCodeBlock();
        MatlabScriptWriter scriptWriter = scriptCode.getCodeWriter();
        scriptWriter
                .comment(SCRIPT_HEADER)
                .add("spm_defaults;")
                .addBlankLine()
                .addCode(serializer.serialize(rootPrefix, contents))
                .add("spm_jobman('run'," + JOBS_VAR + ");");
        scriptWriter.close();
        return new JobScript(rootPrefix, scriptCode.toString());
    }

    public Map<String, Object> createJobStructure(String family, String name, JobNode contents) {
        Map<String, Object> nameEntry = new LinkedHashMap<>();
        nameEntry.put(name, ImmutableList.of(JobNodes.toObject(contents)));
        Map<String, Object> familyEntry = new LinkedHashMap<>();
        familyEntry.put(family, ImmutableList.of(nameEntry));
        Map<String, Object> jobStructure = new LinkedHashMap<>();
        jobStructure.put(JOBS_VAR, ImmutableList.of(familyEntry));
        return jobStructure;
    }
}
