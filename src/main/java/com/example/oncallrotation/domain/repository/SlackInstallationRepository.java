package com.example.oncallrotation.domain.repository;

import com.example.oncallrotation.domain.entity.SlackInstallation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SlackInstallationRepository extends JpaRepository<SlackInstallation, String> {

    List<SlackInstallation> findByTeamId(String teamId);
}
