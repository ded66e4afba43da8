package com.codegym.backend.services;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.codegym.backend.audit.Auditable;
import com.codegym.backend.dto.plan.TrainerMemberDTO;
import com.codegym.backend.dto.plan.WorkoutPlanRequestDTO;
import com.codegym.backend.dto.plan.WorkoutPlanResponseDTO;
import com.codegym.backend.dto.plan.WorkoutRowDTO;
import com.codegym.backend.entities.Member;
import com.codegym.backend.entities.User;
import com.codegym.backend.entities.WorkoutDetail;
import com.codegym.backend.entities.WorkoutPlan;
import com.codegym.backend.exceptions.PlanValidationException;
import com.codegym.backend.mappers.MemberMapper;
import com.codegym.backend.mappers.WorkoutPlanMapper;
import com.codegym.backend.repositories.ExerciseRepository;
import com.codegym.backend.repositories.MemberRepository;
import com.codegym.backend.repositories.WorkoutPlanRepository;
import com.codegym.backend.security.SecurityService;
import com.codegym.backend.services.plans.PlanRow;
import com.codegym.backend.services.plans.PlanScheduleValidator;
import com.codegym.backend.services.plans.PlanValidationResult;
import com.codegym.backend.services.plans.ValidatedRow;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class WorkoutPlanService {

    private final MemberService memberService;
    private final MemberRepository memberRepository;
    private final ExerciseRepository exerciseRepository;
    private final WorkoutPlanRepository workoutPlanRepository;
    private final SystemConfigService systemConfigService;
    private final PlanScheduleValidator planScheduleValidator;
    private final SecurityService securityService;
    private final Clock clock;

    /**
     * Every member, flagged with how many plans the calling trainer wrote for them.
     */
    @Transactional(readOnly = true)
    public List<TrainerMemberDTO> listMembersForCurrentTrainer() {
        User trainer = securityService.getCurrentUser();
        LocalDate today = LocalDate.now(clock);

        Map<UUID, Long> planCounts = new HashMap<>();
        for (Object[] row : workoutPlanRepository.countPlansPerMemberForTrainer(trainer.getId())) {
            planCounts.put((UUID) row[0], ((Number) row[1]).longValue());
        }

        return memberRepository.findAllByOrderByFullNameAsc().stream()
                .map(m -> MemberMapper.toTrainerDTO(m, today, planCounts.getOrDefault(m.getId(), 0L)))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<WorkoutPlanResponseDTO> listPlans(String memberId) {
        Member member = memberService.findById(memberId);
        return workoutPlanRepository.findByMemberIdWithDetails(member.getId()).stream()
                .map(WorkoutPlanMapper::toResponseDTO)
                .toList();
    }

    /**
     * Validates the rows against the current weekly cap and, when every
     * check passes, stores the plan with all of its details. A rejected
     * submission writes nothing.
     */
    @Auditable(action = "WORKOUT_PLAN_CREATED", entityType = "WorkoutPlan")
    @Transactional
    public WorkoutPlanResponseDTO createPlan(String memberId, WorkoutPlanRequestDTO request) {
        Member member = memberService.findById(memberId);
        User trainer = securityService.getCurrentUser();

        List<PlanRow> rows = request.getRows() == null
                ? List.of()
                : request.getRows().stream().map(WorkoutPlanService::toPlanRow).toList();

        int maxTrainingDays = systemConfigService.getMaxTrainingDays();
        PlanValidationResult result = planScheduleValidator.validate(rows, exerciseRepository::existsById, maxTrainingDays);

        if (!result.accepted()) {
            log.info("Plan for member {} rejected: {}", member.getId(), result.messages());
            throw new PlanValidationException(result);
        }

        WorkoutPlan plan = new WorkoutPlan();
        plan.setMember(member);
        plan.setTrainer(trainer);
        plan.setCreatedAt(LocalDateTime.now(clock));
        plan.setNotes(request.getNotes() == null || request.getNotes().isBlank() ? null : request.getNotes().trim());

        for (ValidatedRow row : result.validRows()) {
            WorkoutDetail detail = new WorkoutDetail();
            detail.setExercise(exerciseRepository.getReferenceById(row.exerciseId()));
            detail.setSets(row.sets());
            detail.setReps(row.reps());
            detail.setScheduleDay(row.scheduleDay());
            plan.addDetail(detail);
        }

        WorkoutPlan saved = workoutPlanRepository.save(plan);
        log.info("Trainer {} created plan {} for member {} ({} exercises, days {})",
                trainer.getUsername(), saved.getId(), member.getId(), saved.getDetails().size(), result.distinctDays());

        return WorkoutPlanMapper.toResponseDTO(saved);
    }

    private static PlanRow toPlanRow(WorkoutRowDTO dto) {
        if (dto == null) {
            return null;
        }
        return new PlanRow(dto.getExerciseId(), dto.getSets(), dto.getReps(), dto.getScheduleDay());
    }
}
