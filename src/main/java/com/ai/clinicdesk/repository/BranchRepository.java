package com.ai.clinicdesk.repository;

import com.ai.clinicdesk.entity.Branch;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BranchRepository extends JpaRepository<Branch, String> {
}
