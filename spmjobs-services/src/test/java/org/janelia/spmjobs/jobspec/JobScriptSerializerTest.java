package org.janelia.spmjobs.jobspec;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.hamcrest.MatcherAssert;
import org.junit.Before;
import org.junit.Test;

import java.util.Map;

import static org.hamcrest.CoreMatchers.equalTo;

public class JobScriptSerializerTest {

    private JobScriptSerializer serializer;

    @Before
    public void setUp() {
        serializer = new JobScriptSerializer();
    }

    @Test
    public void scalars() {
        Map<JobNode, String> testData = ImmutableMap.<JobNode, String>builder()
                .put(ScalarNode.of("mean.nii"), "x = 'mean.nii';\n")
                .put(ScalarNode.of(5.0), "x = 5.0;\n")
                .put(ScalarNode.of(4L), "x = 4;\n")
                .put(ScalarNode.of(true), "x = true;\n")
                .put(ScalarNode.of("subject's scan"), "x = 'subject''s scan';\n")
                .build();
        testData.forEach((node, expected) -> MatcherAssert.assertThat(serializer.serialize("x", node), equalTo(expected)));
    }

    @Test
    public void nonFiniteNumbersUseMatlabNames() {
        MatcherAssert.assertThat(serializer.serialize("x", ScalarNode.of(Double.POSITIVE_INFINITY)), equalTo("x = Inf;\n"));
        MatcherAssert.assertThat(serializer.serialize("x", ScalarNode.of(Double.NEGATIVE_INFINITY)), equalTo("x = -Inf;\n"));
        MatcherAssert.assertThat(serializer.serialize("x", ScalarNode.of(Double.NaN)), equalTo("x = NaN;\n"));
    }

    @Test
    public void stringListFromFlagsIsACellArray() {
        JobNode node = JobNodes.fromObject(ImmutableMap.of("weight", ImmutableList.of("w.nii")));
        MatcherAssert.assertThat(serializer.serialize("x.eoptions", node), equalTo(
                "x.eoptions.weight = {...\n" +
                "'w.nii';...\n" +
                "};\n"));
    }

    @Test
    public void orderedGroupIndexesStartAtOne() {
        JobNode node = JobNodes.fromObject(ImmutableList.of(0, 0, 1));
        MatcherAssert.assertThat(serializer.serialize("wrap", node), equalTo(
                "wrap(1) = 0;\n" +
                "wrap(2) = 0;\n" +
                "wrap(3) = 1;\n"));
    }

    @Test
    public void keyedGroupKeepsFieldOrder() {
        KeyedGroupNode node = KeyedGroupNode.builder()
                .put("sep", ScalarNode.of(4.0))
                .put("fwhm", ScalarNode.of(5.0))
                .put("quality", ScalarNode.of(0.9))
                .build();
        MatcherAssert.assertThat(serializer.serialize("eoptions", node), equalTo(
                "eoptions.sep = 4.0;\n" +
                "eoptions.fwhm = 5.0;\n" +
                "eoptions.quality = 0.9;\n"));
    }

    @Test
    public void stringArrayIsOneCellArrayLiteral() {
        JobNode node = StringArrayNode.of("f.nii,1", "f.nii,2");
        MatcherAssert.assertThat(serializer.serialize("jobs{1}.spatial{1}.realign{1}.estimate.data", node), equalTo(
                "jobs{1}.spatial{1}.realign{1}.estimate.data = {...\n" +
                "'f.nii,1';...\n" +
                "'f.nii,2';...\n" +
                "};\n"));
    }

    @Test
    public void nestedGroups() {
        KeyedGroupNode node = KeyedGroupNode.builder()
                .put("data", OrderedGroupNode.of(StringArrayNode.of("a.nii,1"), StringArrayNode.of("b.nii,1")))
                .put("eoptions", KeyedGroupNode.builder().put("rtm", ScalarNode.of(1L)).build())
                .put("roptions", KeyedGroupNode.empty())
                .build();
        MatcherAssert.assertThat(serializer.serialize("j", node), equalTo(
                "j.data(1) = {...\n'a.nii,1';...\n};\n" +
                "j.data(2) = {...\n'b.nii,1';...\n};\n" +
                "j.eoptions.rtm = 1;\n"));
    }

    @Test
    public void quote() {
        MatcherAssert.assertThat(JobScriptSerializer.quote("it's"), equalTo("'it''s'"));
        MatcherAssert.assertThat(JobScriptSerializer.quote(""), equalTo("''"));
    }
}
