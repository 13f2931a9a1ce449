package com.chatter.chatbackend.readindex;

import com.chatter.chatbackend.user.CurrentUserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/read-index")
@RequiredArgsConstructor
public class ReadIndexController {

    private final ReadIndexService readIndexService;
    private final CurrentUserService currentUserService;

    @PutMapping
    public ResponseEntity<Void> update(@Valid @RequestBody UpdateReadIndex body) {
        readIndexService.setReadIndex(currentUserService.currentUid(), body);
        return ResponseEntity.noContent().build();
    }
}
