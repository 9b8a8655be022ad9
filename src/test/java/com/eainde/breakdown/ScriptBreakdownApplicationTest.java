package com.eainde.breakdown;

import com.eainde.breakdown.job.AnalysisComponent;
import com.eainde.breakdown.job.AnalysisJobService;
import com.eainde.breakdown.job.JobPriority;
import com.eainde.breakdown.job.JobResult;
import com.eainde.breakdown.job.JobStatus;
import com.eainde.breakdown.model.ScriptBreakdown;
import com.eainde.breakdown.report.BreakdownJsonWriter;
import com.eainde.breakdown.workflow.SceneParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ScriptBreakdownApplicationTest {

    private static final String SCRIPT = "Scene 1 INT DAY OFFICE\n"
            + "KARIM: We need to talk about the film tomorrow.\n"
            + "\n"
            + "Scene 2 EXT NIGHT STREET\n"
            + "KARIM enters a car.\n";

    @Autowired
    private SceneParser sceneParser;

    @Autowired
    private AnalysisJobService jobService;

    @Autowired
    private BreakdownJsonWriter jsonWriter;

    @Test
    @DisplayName("the context wires a working pipeline")
    void parsesScript() {
        ScriptBreakdown result = sceneParser.parseScript(SCRIPT);

        assertThat(result.totalScenes()).isEqualTo(2);
        assertThat(result.failures()).isEmpty();
        assertThat(result.scene("2").orElseThrow().props().vehicles()).containsExactly("car");
        assertThat(jsonWriter.write(result)).contains("\"total_scenes\"");
    }

    @Test
    @DisplayName("a submitted job completes on the worker pool")
    void jobCompletes() throws InterruptedException {
        String jobId = jobService.submit(SCRIPT, AnalysisComponent.PROP_CLASSIFICATION, JobPriority.HIGH, false);

        Instant deadline = Instant.now().plus(Duration.ofSeconds(30));
        JobResult result = jobService.getResult(jobId);
        while (!result.status().isTerminal() && Instant.now().isBefore(deadline)) {
            Thread.sleep(50);
            result = jobService.getResult(jobId);
        }

        assertThat(result.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(result.result().successCount()).isEqualTo(2);
    }
}
