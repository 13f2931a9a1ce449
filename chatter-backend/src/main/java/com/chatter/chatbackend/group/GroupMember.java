package com.chatter.chatbackend.group;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Data
@Table(name = "user_group_rel",
        uniqueConstraints = @UniqueConstraint(columnNames = {"gid", "uid"}))
public class GroupMember {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "gid", nullable = false)
    private Long groupId;

    @Column(name = "uid", nullable = false)
    private Long userId;

    private Instant joinedAt = Instant.now();

    // muted members stay in the group but may not send
    private boolean forbid = false;
}
