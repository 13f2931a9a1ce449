package com.chatter.chatbackend;

import com.chatter.chatbackend.user.Role;
import com.chatter.chatbackend.user.User;
import com.chatter.chatbackend.user.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.security.crypto.password.PasswordEncoder;

@EnableScheduling
@ConfigurationPropertiesScan
@SpringBootApplication
@Slf4j
public class ChatterBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatterBackendApplication.class, args);
    }

    // Create admin user on startup
    @Bean
    public CommandLineRunner createAdmin(UserRepository userRepository,
                                         PasswordEncoder passwordEncoder,
                                         @Value("${app.admin.name:admin}") String adminName,
                                         @Value("${app.admin.password:password123}") String adminPassword) {
        return args -> {
            if (!userRepository.existsByName(adminName)) {
                User admin = new User();
                admin.setName(adminName);
                admin.setPassword(passwordEncoder.encode(adminPassword));
                admin.setRole(Role.ADMIN);
                userRepository.save(admin);
                log.info("Admin user created: {}", adminName);
            } else {
                log.info("Admin user already exists");
            }
        };
    }
}
