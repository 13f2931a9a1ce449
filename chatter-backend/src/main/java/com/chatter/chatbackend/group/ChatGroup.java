package com.chatter.chatbackend.group;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Data
@Table(name = "chat_group")
public class ChatGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String name;

    @Column(name = "admin_uid", nullable = false)
    private Long adminUid;

    private Instant createdAt = Instant.now();
    private Instant updatedAt;
}
