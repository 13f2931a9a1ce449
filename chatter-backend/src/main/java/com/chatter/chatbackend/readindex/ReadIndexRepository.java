package com.chatter.chatbackend.readindex;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ReadIndexRepository extends JpaRepository<ReadIndex, Long> {

    Optional<ReadIndex> findByUidAndTargetUid(Long uid, Long targetUid);

    Optional<ReadIndex> findByUidAndTargetGid(Long uid, Long targetGid);

    List<ReadIndex> findByUidOrderByLatestMidDesc(Long uid);
}
