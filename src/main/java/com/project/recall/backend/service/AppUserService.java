package com.project.recall.backend.service;

import com.project.recall.backend.entity.AppUser;
import com.project.recall.backend.exception.ExceptionMessage;
import com.project.recall.backend.exception.UserDoesNotExistException;
import com.project.recall.backend.repository.AppUserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
public class AppUserService {

    private final AppUserRepository appUserRepository;

    AppUserService(AppUserRepository appUserRepository) {
        this.appUserRepository = appUserRepository;
    }

    public AppUser loadUserByUsername(String username) {
        if(username == null || username.isBlank()) {
            throw new UserDoesNotExistException(ExceptionMessage.USER_DOES_NOT_EXIST);
        }

        Optional<AppUser> user = appUserRepository.findByUsername(username);

        if(user.isPresent()) {
            return user.get();
        } else {
            throw new UserDoesNotExistException(ExceptionMessage.USER_DOES_NOT_EXIST, username);
        }
    }

    /**
     * The chat a user's reviews go to: the configured notification chat, falling back to the
     * user's direct chat with the bot.
     *
     * @throws UserDoesNotExistException if the user is unknown or has no chat at all.
     */
    public String resolveDeliveryTarget(Integer userId) {
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> new UserDoesNotExistException(ExceptionMessage.USER_DOES_NOT_EXIST, userId));

        if (user.getNotificationChatId() != null && !user.getNotificationChatId().isBlank()) {
            return user.getNotificationChatId();
        }
        if (user.getTelegramUserId() != null) {
            return String.valueOf(user.getTelegramUserId());
        }
        throw new UserDoesNotExistException(ExceptionMessage.NO_DELIVERY_TARGET, userId);
    }
}
