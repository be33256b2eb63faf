package com.chatdesk.chat.service;

import com.chatdesk.chat.repository.ChatRepository;
import com.chatdesk.user.domain.UserRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Authorization checks for conversations.
 *
 * A user may open a conversation when it belongs to the user's tenant and the user is an
 * administrator or manager, the assigned agent, or the owner of the social connection the
 * conversation arrived through.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ChatPermissionService {

    private final ChatRepository chatRepository;

    public boolean canAccessChat(UUID userId, UUID tenantId, UUID chatId) {
        boolean allowed = chatRepository.isAccessibleBy(chatId, tenantId, userId, UserRole.CONVERSATION_SUPERVISORS);
        if (!allowed) {
            log.warn("Access denied: user={} cannot access chat={} in tenant={}", userId, chatId, tenantId);
        }
        return allowed;
    }
}
