package com.example.jobtrigger.integration;

import com.example.jobtrigger.TestcontainersConfiguration;
import com.example.jobtrigger.domain.entity.TriggerDefinition;
import com.example.jobtrigger.domain.repository.TriggerDefinitionRepository;
import com.example.jobtrigger.service.bootstrap.ConfiguredJobsBootstrapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.quartz.CronTrigger;
import org.quartz.Job;
import org.quartz.JobBuilder;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.TriggerKey;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.MOCK,
        properties = {
                "spring.main.web-application-type=servlet",
                "spring.quartz.jdbc.initialize-schema=always",
                "jobs.schedule-on-startup=true",
                "jobs.triggers.cleanup=0 0 3 * * ?",
                "jobs.triggers-from-db.sync[0].trigger-name=hourly",
                "jobs.triggers-from-db.archive[0].trigger-name=weekly",
                "slack.enabled=false"
        }
)
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Job Scheduling Integration Tests")
class JobSchedulingApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TriggerDefinitionRepository triggerDefinitionRepository;

    @Autowired
    private Scheduler scheduler;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ConfiguredJobsBootstrapper configuredJobsBootstrapper;

    @TestConfiguration(proxyBeanMethods = false)
    static class JobDetailsConfiguration {

        @Bean
        JobDetail cleanupJobDetail() {
            return durableJob("cleanup");
        }

        @Bean
        JobDetail syncJobDetail() {
            return durableJob("sync");
        }

        @Bean
        JobDetail archiveJobDetail() {
            return durableJob("archive");
        }

        private static JobDetail durableJob(String name) {
            return JobBuilder.newJob(NoOpJob.class).withIdentity(name).storeDurably().build();
        }
    }

    public static class NoOpJob implements Job {
        @Override
        public void execute(JobExecutionContext context) {
        }
    }

    @BeforeEach
    void setUp() throws SchedulerException {
        triggerDefinitionRepository.deleteAll();
        scheduler.unscheduleJob(TriggerKey.triggerKey("hourly"));
        scheduler.unscheduleJob(TriggerKey.triggerKey("weekly"));
    }

    private TriggerDefinition saveDefinition(String triggerName, String cron, Map<String, Object> triggerData) {
        return triggerDefinitionRepository.save(TriggerDefinition.builder()
                .triggerName(triggerName)
                .cronExpression(cron)
                .triggerData(triggerData)
                .description("Integration test definition")
                .build());
    }

    @Nested
    @DisplayName("Startup Bootstrap")
    class StartupBootstrapTests {

        @Test
        @DisplayName("Should register configured simple trigger on startup under a cluster lock")
        void shouldRegisterSimpleTriggerOnStartup() throws Exception {
            var trigger = scheduler.getTrigger(TriggerKey.triggerKey("cleanup"));

            assertThat(trigger).isInstanceOf(CronTrigger.class);
            assertThat(((CronTrigger) trigger).getCronExpression()).isEqualTo("0 0 3 * * ?");
            assertThat(trigger.getJobKey().getName()).isEqualTo("cleanup");

            var locks = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM shedlock WHERE name = 'configuredJobsBootstrap'", Integer.class);
            assertThat(locks).isEqualTo(1);
            assertThat(AopUtils.isAopProxy(configuredJobsBootstrapper)).isTrue();
        }

        @Test
        @DisplayName("Should reject scheduling a job that startup already scheduled")
        void shouldRejectAlreadyScheduledJob() throws Exception {
            mockMvc.perform(post("/api/v1/jobs/cleanup"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.success").value(false));
        }
    }

    @Nested
    @DisplayName("Trigger Definition Storage")
    class TriggerDefinitionStorageTests {

        @Test
        @DisplayName("Should round-trip trigger data through the jsonb column")
        void shouldRoundTripTriggerData() {
            saveDefinition("hourly", "0 0 * * * ?", Map.of("region", "eu", "batchSize", 500));

            var loaded = triggerDefinitionRepository.findByTriggerName("hourly");

            assertThat(loaded).isPresent();
            assertThat(loaded.get().getCronExpression()).isEqualTo("0 0 * * * ?");
            assertThat(loaded.get().getTriggerData())
                    .containsEntry("region", "eu")
                    .containsEntry("batchSize", 500);
            assertThat(loaded.get().getCreatedAt()).isNotNull();
        }
    }

    @Nested
    @DisplayName("Scheduling API")
    class SchedulingApiTests {

        @Test
        @DisplayName("Should register stored trigger with its data via API")
        void shouldRegisterStoredTriggerViaApi() throws Exception {
            saveDefinition("hourly", "0 0 * * * ?", Map.of("region", "eu", "batchSize", 500));

            mockMvc.perform(post("/api/v1/jobs/sync"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.source").value("from-store"))
                    .andExpect(jsonPath("$.data.registeredTriggers", hasSize(1)))
                    .andExpect(jsonPath("$.data.registeredTriggers[0]").value("hourly"));

            var trigger = scheduler.getTrigger(TriggerKey.triggerKey("hourly"));
            assertThat(trigger).isInstanceOf(CronTrigger.class);
            assertThat(((CronTrigger) trigger).getCronExpression()).isEqualTo("0 0 * * * ?");
            assertThat(trigger.getJobKey().getName()).isEqualTo("sync");
            assertThat(trigger.getJobDataMap().getString("region")).isEqualTo("eu");
            assertThat(trigger.getJobDataMap().get("batchSize")).isEqualTo(500);
        }

        @Test
        @DisplayName("Should list registered triggers with their data")
        void shouldListRegisteredTriggers() throws Exception {
            saveDefinition("hourly", "0 0 * * * ?", Map.of("region", "eu"));
            mockMvc.perform(post("/api/v1/jobs/sync"))
                    .andExpect(status().isOk());

            mockMvc.perform(get("/api/v1/jobs/sync/triggers"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data", hasSize(1)))
                    .andExpect(jsonPath("$.data[0].name").value("hourly"))
                    .andExpect(jsonPath("$.data[0].cronExpression").value("0 0 * * * ?"))
                    .andExpect(jsonPath("$.data[0].triggerData.region").value("eu"));
        }

        @Test
        @DisplayName("Should apply cron override from request body")
        void shouldApplyCronOverride() throws Exception {
            saveDefinition("hourly", "0 0 * * * ?", Map.of());

            mockMvc.perform(post("/api/v1/jobs/sync")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"triggerName": "hourly", "cronExpression": "0 30 * * * ?"}
                                    """))
                    .andExpect(status().isOk());

            var trigger = (CronTrigger) scheduler.getTrigger(TriggerKey.triggerKey("hourly"));
            assertThat(trigger.getCronExpression()).isEqualTo("0 30 * * * ?");
        }

        @Test
        @DisplayName("Should return 502 and register nothing when the stored definition is missing")
        void shouldFailWhenDefinitionMissing() throws Exception {
            mockMvc.perform(post("/api/v1/jobs/archive"))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.success").value(false));

            assertThat(scheduler.getTrigger(TriggerKey.triggerKey("weekly"))).isNull();
        }
    }
}
