package com.codegym.backend.seed;

import java.math.BigDecimal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.codegym.backend.entities.Exercise;
import com.codegym.backend.entities.MembershipPackage;
import com.codegym.backend.entities.SystemConfig;
import com.codegym.backend.entities.User;
import com.codegym.backend.enums.Role;
import com.codegym.backend.repositories.ExerciseRepository;
import com.codegym.backend.repositories.MembershipPackageRepository;
import com.codegym.backend.repositories.SystemConfigRepository;
import com.codegym.backend.repositories.UserRepository;

/**
 * Fills an empty database with one account per role, the standard packages,
 * a few exercises and the default weekly training cap. Rows that already
 * exist are left untouched, so the runner can stay enabled across restarts.
 */
@Component
@ConditionalOnProperty(name = "gym.seed.enabled", havingValue = "true")
public class GymSeedRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(GymSeedRunner.class);

    private final UserRepository userRepository;
    private final MembershipPackageRepository packageRepository;
    private final ExerciseRepository exerciseRepository;
    private final SystemConfigRepository systemConfigRepository;
    private final PasswordEncoder passwordEncoder;

    public GymSeedRunner(
            UserRepository userRepository,
            MembershipPackageRepository packageRepository,
            ExerciseRepository exerciseRepository,
            SystemConfigRepository systemConfigRepository,
            PasswordEncoder passwordEncoder
    ) {
        this.userRepository = userRepository;
        this.packageRepository = packageRepository;
        this.exerciseRepository = exerciseRepository;
        this.systemConfigRepository = systemConfigRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        ensureUser("admin", "admin@codegym.local", "admin123", Role.ADMIN);
        ensureUser("receptionist", "receptionist@codegym.local", "reception123", Role.RECEPTIONIST);
        ensureUser("trainer", "trainer@codegym.local", "trainer123", Role.TRAINER);
        ensureUser("cashier", "cashier@codegym.local", "cashier123", Role.CASHIER);

        ensurePackage("1 Month", 1, "500000", "One month of unlimited gym access");
        ensurePackage("3 Months", 3, "1200000", "Three months of unlimited gym access");
        ensurePackage("6 Months", 6, "2000000", "Six months of unlimited gym access");
        ensurePackage("12 Months", 12, "3500000", "A full year of unlimited gym access");

        ensureExercise("Squat", "Barbell back squat", "Legs");
        ensureExercise("Bench Press", "Flat barbell bench press", "Chest");
        ensureExercise("Deadlift", "Conventional barbell deadlift", "Back");

        if (systemConfigRepository.findByKey(SystemConfig.MAX_TRAINING_DAYS).isEmpty()) {
            SystemConfig config = new SystemConfig();
            config.setKey(SystemConfig.MAX_TRAINING_DAYS);
            config.setValue("6");
            config.setDescription("Maximum training days per week for workout plans");
            systemConfigRepository.save(config);
            logger.info("[Seed] max_training_days set to 6");
        }
    }

    private void ensureUser(String username, String email, String rawPassword, Role role) {
        if (userRepository.existsByUsername(username)) {
            return;
        }
        User user = new User();
        user.setUsername(username);
        user.setEmail(email);
        user.setPassword(passwordEncoder.encode(rawPassword));
        user.setRole(role);
        user.setActive(true);
        userRepository.save(user);
        logger.info("[Seed] {} account '{}' created", role, username);
    }

    private void ensurePackage(String name, int months, String price, String description) {
        if (packageRepository.existsByNameIgnoreCase(name)) {
            return;
        }
        MembershipPackage pkg = new MembershipPackage();
        pkg.setName(name);
        pkg.setDurationMonths(months);
        pkg.setPrice(new BigDecimal(price));
        pkg.setDescription(description);
        packageRepository.save(pkg);
        logger.info("[Seed] Package '{}' created", name);
    }

    private void ensureExercise(String name, String description, String bodyPart) {
        if (exerciseRepository.existsByNameIgnoreCase(name)) {
            return;
        }
        Exercise exercise = new Exercise();
        exercise.setName(name);
        exercise.setDescription(description);
        exercise.setBodyPart(bodyPart);
        exerciseRepository.save(exercise);
    }
}
