package com.example.oncallrotation.integration;

import com.example.oncallrotation.client.ClientModels.OAuthGrant;
import com.example.oncallrotation.client.ClientModels.OnCallUser;
import com.example.oncallrotation.client.ClientModels.UserGroup;
import com.example.oncallrotation.client.PagerDutyClient;
import com.example.oncallrotation.client.SlackApiClient;
import com.example.oncallrotation.domain.entity.RotationTask;
import com.example.oncallrotation.domain.entity.RotationTaskKey;
import com.example.oncallrotation.domain.entity.SlackInstallation;
import com.example.oncallrotation.domain.repository.RotationTaskRepository;
import com.example.oncallrotation.domain.repository.SlackInstallationRepository;
import com.example.oncallrotation.scheduler.TriggerScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Oncall Rotation Integration Tests")
class OncallRotationIntegrationTest {

    private static final String SIGNING_SECRET = "test-signing-secret";
    private static final String TEAM = "T1:";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RotationTaskRepository taskRepository;

    @Autowired
    private SlackInstallationRepository installationRepository;

    @MockBean
    private TriggerScheduler triggerScheduler;

    @MockBean
    private SlackApiClient slackApiClient;

    @MockBean
    private PagerDutyClient pagerDutyClient;

    @BeforeEach
    void setUp() {
        taskRepository.deleteAll();
        installationRepository.deleteAll();
    }

    private void givenInstallation() {
        var now = Instant.now();
        installationRepository.save(SlackInstallation.builder()
                .id(TEAM)
                .teamId("T1")
                .teamName("Acme")
                .accessToken("xoxb-install")
                .pagerDutyToken("pd-workspace")
                .createdAt(now)
                .lastUpdatedAt(now)
                .build());
    }

    private RotationTask givenTask(long nextOccurrenceUtc) {
        var now = Instant.now();
        return taskRepository.save(RotationTask.builder()
                .team(TEAM)
                .taskId("ops:C1:platform-support:S111:PSCHED1")
                .cronExpression("0 9 * * *")
                .timezone("UTC")
                .nextOccurrenceUtc(nextOccurrenceUtc)
                .nextOccurrenceLocal("")
                .teamId("T1")
                .channelId("C1")
                .channelName("ops")
                .userGroupId("S111")
                .userGroupHandle("platform-support")
                .pagerDutyScheduleId("PSCHED1")
                .createdAt(now)
                .lastUpdatedAt(now)
                .build());
    }

    private static MockHttpServletRequestBuilder signedCommand(String text) throws Exception {
        return signedBody("team_id=T1&team_domain=acme&channel_id=C1&channel_name=ops&user_id=U42&user_name=alice"
                + "&command=%2Foncall&text=" + URLEncoder.encode(text, StandardCharsets.UTF_8));
    }

    private static MockHttpServletRequestBuilder signedBody(String body) throws Exception {
        var timestamp = Instant.now().getEpochSecond();

        var mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(SIGNING_SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        var signature = "v0=" + HexFormat.of().formatHex(mac.doFinal(("v0:" + timestamp + ":" + body).getBytes(StandardCharsets.UTF_8)));

        return post("/slack/commands")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .header("X-Slack-Request-Timestamp", String.valueOf(timestamp))
                .header("X-Slack-Signature", signature)
                .content(body);
    }

    @Nested
    @DisplayName("Slash Command API")
    class SlashCommandApiTests {

        @Test
        @DisplayName("Should register a schedule and create its wake-up trigger")
        void shouldRegisterSchedule() throws Exception {
            mockMvc.perform(signedCommand("schedule --user-group <!subteam^S111|@platform-support> "
                            + "--pagerduty-schedule PSCHED1 --cron \"0 9 * * MON\" --timezone Australia/Sydney"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.response_type").value("in_channel"))
                    .andExpect(jsonPath("$.blocks[0].text.text")
                            .value(startsWith("Update user group: S111|platform-support based on pagerduty schedule: PSCHED1")));

            var saved = taskRepository.findById(new RotationTaskKey(TEAM, "ops:C1:platform-support:S111:PSCHED1"));
            assertThat(saved).hasValueSatisfying(task -> {
                assertThat(task.getTimezone()).isEqualTo("Australia/Sydney");
                assertThat(task.getNextOccurrenceUtc()).isGreaterThan(Instant.now().getEpochSecond());
            });
            verify(triggerScheduler).createOneShotTrigger(ArgumentMatchers.startsWith("oncall-rotation-test-"), anyString(), any(), any(), anyString());
        }

        @Test
        @DisplayName("Should answer invalid input with an ephemeral message")
        void shouldAnswerInvalidInput() throws Exception {
            mockMvc.perform(signedCommand("schedule --user-group @support --pagerduty-schedule PSCHED1 --cron '0 9 * * MON'"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.response_type").value("ephemeral"))
                    .andExpect(jsonPath("$.text").value("Invalid user group: @support"));

            assertThat(taskRepository.count()).isZero();
        }

        @Test
        @DisplayName("Should tell a workspace that never installed the app")
        void shouldAnswerMissingInstallation() throws Exception {
            mockMvc.perform(signedCommand("setup-paging --pagerduty-api-key pd-new"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.text").value("Slack installation not found: T1:"));
        }

        @Test
        @DisplayName("Should store the workspace PagerDuty key encrypted")
        void shouldStoreWorkspaceKey() throws Exception {
            givenInstallation();

            mockMvc.perform(signedCommand("setup-paging --pagerduty-api-key pd-new"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.blocks[0].text.text").value("Set up PagerDuty with the API key"));

            assertThat(installationRepository.findById(TEAM))
                    .hasValueSatisfying(installation -> assertThat(installation.getPagerDutyToken()).isEqualTo("pd-new"));
        }

        @Test
        @DisplayName("Should answer a malformed form body with an ephemeral message")
        void shouldAnswerMalformedBody() throws Exception {
            mockMvc.perform(signedBody("team_id=T1&channel_id=C1&text=list-schedules%zz"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.response_type").value("ephemeral"))
                    .andExpect(jsonPath("$.text").value(startsWith("Malformed slash command request")));

            assertThat(taskRepository.count()).isZero();
        }

        @Test
        @DisplayName("Should reject a request with a bad signature")
        void shouldRejectBadSignature() throws Exception {
            mockMvc.perform(post("/slack/commands")
                            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                            .header("X-Slack-Request-Timestamp", String.valueOf(Instant.now().getEpochSecond()))
                            .header("X-Slack-Signature", "v0=deadbeef")
                            .content("team_id=T1&text=list-schedules"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.success").value(false));
        }
    }

    @Nested
    @DisplayName("OAuth API")
    class OAuthApiTests {

        @Test
        @DisplayName("Should store the installation from the OAuth code")
        void shouldCompleteOAuth() throws Exception {
            when(slackApiClient.exchangeOAuthCode("code-1")).thenReturn(OAuthGrant.builder()
                    .teamId("T1")
                    .teamName("Acme")
                    .accessToken("xoxb-new")
                    .build());

            mockMvc.perform(get("/slack/oauth/callback").param("code", "code-1"))
                    .andExpect(status().isOk())
                    .andExpect(content().string("Received slack oauth callback."));

            assertThat(installationRepository.findById(TEAM))
                    .hasValueSatisfying(installation -> assertThat(installation.getAccessToken()).isEqualTo("xoxb-new"));
        }

        @Test
        @DisplayName("Should reject a callback without a code")
        void shouldRejectMissingCode() throws Exception {
            mockMvc.perform(get("/slack/oauth/callback"))
                    .andExpect(status().isBadRequest())
                    .andExpect(content().string("Invalid request"));

            verify(slackApiClient, never()).exchangeOAuthCode(anyString());
        }
    }

    @Nested
    @DisplayName("Rotation API")
    class RotationApiTests {

        @Test
        @DisplayName("Should sync a due task, advance it and schedule the next wake-up")
        void shouldRunRotation() throws Exception {
            givenInstallation();
            givenTask(Instant.now().getEpochSecond() - 60);
            when(pagerDutyClient.getOnCallUsers(eq("PSCHED1"), eq("pd-workspace"), any(), any()))
                    .thenReturn(List.of(OnCallUser.builder().name("Alice").email("alice@example.com").build()));
            when(slackApiClient.findGroupByNameOrHandle("xoxb-install", "platform-support"))
                    .thenReturn(Optional.of(UserGroup.builder().id("S111").handle("platform-support").build()));
            when(slackApiClient.findUserByEmail("xoxb-install", "alice@example.com")).thenReturn(Optional.of("U1"));
            when(slackApiClient.listGroupMembers("xoxb-install", "S111")).thenReturn(List.of("U9"));

            mockMvc.perform(post("/api/v1/rotations/run"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.dueTasks").value(1))
                    .andExpect(jsonPath("$.data.changed").value(1))
                    .andExpect(jsonPath("$.data.failed").value(0))
                    .andExpect(jsonPath("$.data.createdTrigger").value(startsWith("oncall-rotation-test-")));

            verify(slackApiClient).setGroupMembers("xoxb-install", "S111", List.of("U1"));
            verify(slackApiClient).postMessage("xoxb-install", "C1", "Updated support user group <!subteam^S111> to: <@U1>");
            assertThat(taskRepository.findById(new RotationTaskKey(TEAM, "ops:C1:platform-support:S111:PSCHED1")))
                    .hasValueSatisfying(task -> assertThat(task.getNextOccurrenceUtc()).isGreaterThan(Instant.now().getEpochSecond()));
        }

        @Test
        @DisplayName("Should list the tasks of a team without exposing tokens")
        void shouldListTasks() throws Exception {
            givenTask(Instant.now().getEpochSecond() + 3600);

            mockMvc.perform(get("/api/v1/rotations").param("team", TEAM))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data", hasSize(1)))
                    .andExpect(jsonPath("$.data[0].userGroupHandle").value("platform-support"))
                    .andExpect(jsonPath("$.data[0].hasPagerDutyToken").value(false))
                    .andExpect(jsonPath("$.data[0].pagerDutyToken").doesNotExist());
        }

        @Test
        @DisplayName("Should delete a task and return 404 the second time")
        void shouldDeleteTask() throws Exception {
            givenTask(Instant.now().getEpochSecond() + 3600);

            mockMvc.perform(delete("/api/v1/rotations/{team}/{taskId}", TEAM, "ops:C1:platform-support:S111:PSCHED1"))
                    .andExpect(status().isOk());
            mockMvc.perform(delete("/api/v1/rotations/{team}/{taskId}", TEAM, "ops:C1:platform-support:S111:PSCHED1"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.success").value(false));

            assertThat(taskRepository.count()).isZero();
        }
    }
}
