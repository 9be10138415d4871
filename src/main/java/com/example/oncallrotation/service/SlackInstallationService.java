package com.example.oncallrotation.service;

import com.example.oncallrotation.client.SlackApiClient;
import com.example.oncallrotation.domain.entity.SlackInstallation;
import com.example.oncallrotation.domain.repository.SlackInstallationRepository;
import com.example.oncallrotation.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Workspace installations: OAuth completion and PagerDuty token setup
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlackInstallationService {

    private final SlackInstallationRepository installationRepository;
    private final SlackApiClient slackApiClient;
    private final Clock clock;

    /**
     * Exchange an OAuth code for a bot token and store the installation, replacing any earlier one
     * for the same workspace.
     */
    @Transactional
    public SlackInstallation completeOAuth(String code) {
        var grant = slackApiClient.exchangeOAuthCode(code);
        var now = clock.instant();

        var installation = SlackInstallation.builder()
                .id(SlackInstallation.idOf(grant.getTeamId(), grant.getEnterpriseId()))
                .teamId(grant.getTeamId())
                .teamName(grant.getTeamName())
                .enterpriseId(grant.getEnterpriseId())
                .enterpriseName(grant.getEnterpriseName())
                .enterpriseInstall(grant.isEnterpriseInstall())
                .accessToken(grant.getAccessToken())
                .tokenType(grant.getTokenType())
                .scope(grant.getScope())
                .authedUserId(grant.getAuthedUserId())
                .appId(grant.getAppId())
                .botUserId(grant.getBotUserId())
                .createdAt(now)
                .lastUpdatedAt(now)
                .build();

        // keep a PagerDuty token set up before a reinstall
        installationRepository.findById(installation.getId())
                .ifPresent(existing -> {
                    installation.setPagerDutyToken(existing.getPagerDutyToken());
                    installation.setCreatedAt(existing.getCreatedAt());
                });

        var saved = installationRepository.save(installation);
        log.info("Saved Slack installation {} ({})", saved.getId(), saved.getTeamName());
        return saved;
    }

    /**
     * @throws ResourceNotFoundException if the workspace never installed the app
     */
    @Transactional
    public void updatePagerDutyToken(String id, String pagerDutyToken) {
        var installation = installationRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Slack installation", id));

        installation.setPagerDutyToken(pagerDutyToken);
        installation.setLastUpdatedAt(clock.instant());
        installationRepository.save(installation);

        log.info("Updated PagerDuty token of installation {}", id);
    }

    @Transactional(readOnly = true)
    public List<SlackInstallation> findAll() {
        return installationRepository.findAll();
    }
}
