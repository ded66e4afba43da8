package com.codegym.backend.seed;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.security.crypto.password.PasswordEncoder;

import com.codegym.backend.entities.Exercise;
import com.codegym.backend.entities.MembershipPackage;
import com.codegym.backend.entities.SystemConfig;
import com.codegym.backend.entities.User;
import com.codegym.backend.repositories.ExerciseRepository;
import com.codegym.backend.repositories.MembershipPackageRepository;
import com.codegym.backend.repositories.SystemConfigRepository;
import com.codegym.backend.repositories.UserRepository;

@ExtendWith(MockitoExtension.class)
class GymSeedRunnerTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private MembershipPackageRepository packageRepository;

    @Mock
    private ExerciseRepository exerciseRepository;

    @Mock
    private SystemConfigRepository systemConfigRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    @InjectMocks
    private GymSeedRunner seedRunner;

    @Test
    void run_emptyDatabase_createsAccountsCatalogAndDayCap() {
        when(userRepository.existsByUsername(anyString())).thenReturn(false);
        when(packageRepository.existsByNameIgnoreCase(anyString())).thenReturn(false);
        when(exerciseRepository.existsByNameIgnoreCase(anyString())).thenReturn(false);
        when(systemConfigRepository.findByKey(SystemConfig.MAX_TRAINING_DAYS)).thenReturn(Optional.empty());
        when(passwordEncoder.encode(anyString())).thenReturn("hash");

        seedRunner.run(new DefaultApplicationArguments());

        verify(userRepository, times(4)).save(any(User.class));
        verify(packageRepository, times(4)).save(any(MembershipPackage.class));
        verify(exerciseRepository, times(3)).save(any(Exercise.class));
        verify(systemConfigRepository).save(any(SystemConfig.class));
    }

    @Test
    void run_seededDatabase_changesNothing() {
        when(userRepository.existsByUsername(anyString())).thenReturn(true);
        when(packageRepository.existsByNameIgnoreCase(anyString())).thenReturn(true);
        when(exerciseRepository.existsByNameIgnoreCase(anyString())).thenReturn(true);
        when(systemConfigRepository.findByKey(SystemConfig.MAX_TRAINING_DAYS))
                .thenReturn(Optional.of(new SystemConfig()));

        seedRunner.run(new DefaultApplicationArguments());

        verify(userRepository, never()).save(any());
        verify(packageRepository, never()).save(any());
        verify(exerciseRepository, never()).save(any());
        verify(systemConfigRepository, never()).save(any());
    }
}
