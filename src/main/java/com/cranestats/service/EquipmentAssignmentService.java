package com.cranestats.service;

import com.cranestats.model.EquipmentAssignment;
import com.cranestats.repository.EquipmentAssignmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Which cranes each spreader has accrued usage on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EquipmentAssignmentService {

    private final EquipmentAssignmentRepository assignmentRepository;
    private final ResourceLoader resourceLoader;
    private final CsvTableReader csvTableReader;

    @Transactional(readOnly = true)
    public List<String> members(String compositeEntityId) {
        return assignmentRepository.findByCompositeEntityIdOrderByMemberEntityIdAsc(compositeEntityId).stream()
            .map(EquipmentAssignment::getMemberEntityId)
            .toList();
    }

    /**
     * @return false when the pair is already assigned
     */
    public boolean assign(String compositeEntityId, String memberEntityId) {
        String composite = compositeEntityId.strip();
        String member = memberEntityId.strip();
        if (assignmentRepository.existsByCompositeEntityIdAndMemberEntityId(composite, member)) {
            return false;
        }
        try {
            assignmentRepository.saveAndFlush(EquipmentAssignment.builder()
                .compositeEntityId(composite)
                .memberEntityId(member)
                .build());
        } catch (DataIntegrityViolationException e) {
            log.debug("Assignment {} -> {} stored concurrently", composite, member);
            return false;
        }
        log.info("Assigned {} to {}", member, composite);
        return true;
    }

    /**
     * @return false when the pair was not assigned
     */
    @Transactional
    public boolean unassign(String compositeEntityId, String memberEntityId) {
        return assignmentRepository.findByCompositeEntityIdAndMemberEntityId(compositeEntityId, memberEntityId)
            .map(assignment -> {
                assignmentRepository.delete(assignment);
                log.info("Removed {} from {}", memberEntityId, compositeEntityId);
                return true;
            })
            .orElse(false);
    }

    /**
     * Applies a composite_entity_id,member_entity_id table. Existing pairs are left alone.
     *
     * @return number of new assignments
     */
    public int seed(String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Assignment seed file '{}' not found", location);
            return 0;
        }
        int added = 0;
        for (Map<String, String> row : csvTableReader.read(resource)) {
            String composite = row.get("composite_entity_id");
            String member = row.get("member_entity_id");
            if (composite == null || composite.isBlank() || member == null || member.isBlank()) {
                log.warn("Assignment seed row skipped, missing ids: {}", row);
                continue;
            }
            if (assign(composite, member)) {
                added++;
            }
        }
        log.info("Assignment seed '{}' added {} pair(s)", location, added);
        return added;
    }
}
