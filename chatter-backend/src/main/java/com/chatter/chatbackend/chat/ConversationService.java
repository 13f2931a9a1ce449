package com.chatter.chatbackend.chat;

import com.chatter.chatbackend.readindex.ReadIndex;
import com.chatter.chatbackend.readindex.ReadIndexService;
import com.chatter.chatbackend.readindex.UnreadCounter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class ConversationService {

    private final ReadIndexService readIndexService;
    private final UnreadCounter unreadCounter;
    private final ChatMessageService chatMessageService;

    /** One entry per conversation the user takes part in, most recently active first. */
    public List<ConversationSummary> listConversations(long uid) {
        List<ReadIndex> rows = readIndexService.listForUser(uid);
        List<ConversationSummary> out = new ArrayList<>(rows.size());

        for (ReadIndex r : rows) {
            MessageTarget target;
            if (r.isDm()) {
                target = new MessageTarget.ToUser(r.getTargetUid());
            } else if (r.isGroup()) {
                target = new MessageTarget.ToGroup(r.getTargetGid());
            } else {
                continue;
            }
            ChatMessage latest = chatMessageService.findVisible(uid, r.getLatestMid()).orElse(null);

            out.add(ConversationSummary.builder()
                    .target(target)
                    .latestMid(r.getLatestMid())
                    .uidOfLatestMsg(r.getUidOfLatestMsg())
                    .latestMessage(latest)
                    .unread(unreadCounter.countUnread(r).orElse(null))
                    .build());
        }
        return out;
    }
}
