package com.chatter.chatbackend.readindex;

import jakarta.persistence.*;
import lombok.*;

/**
 * Per user, per conversation pointers: what the user has acknowledged ({@code mid}) and the newest
 * message seen in the conversation together with its sender.
 */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "read_index", uniqueConstraints = {
        @UniqueConstraint(name = "uk_read_index_user", columnNames = {"uid", "target_uid"}),
        @UniqueConstraint(name = "uk_read_index_group", columnNames = {"uid", "target_gid"})
})
public class ReadIndex {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long uid;

    @Column(name = "target_uid")
    private Long targetUid;

    @Column(name = "target_gid")
    private Long targetGid;

    // null until the user acknowledges anything in this conversation
    private Long mid;

    @Column(name = "latest_mid", nullable = false)
    private Long latestMid;

    @Column(name = "uid_of_latest_msg", nullable = false)
    private Long uidOfLatestMsg;

    public boolean isDm() {
        return targetUid != null && targetGid == null;
    }

    public boolean isGroup() {
        return targetGid != null && targetUid == null;
    }
}
