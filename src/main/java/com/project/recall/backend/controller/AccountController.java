package com.project.recall.backend.controller;

import com.project.recall.backend.entity.AppUser;
import com.project.recall.backend.response.ApiResponse;
import com.project.recall.backend.response.ResponseMessage;
import com.project.recall.backend.service.AppUserService;
import com.project.recall.backend.service.security.AppUserDetails;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.web.authentication.logout.SecurityContextLogoutHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
public class AccountController {

    private final AppUserService appUserService;

    public AccountController(AppUserService appUserService) {
        this.appUserService = appUserService;
    }

    @GetMapping("/login")
    public ResponseEntity<ApiResponse> tryLogin(@AuthenticationPrincipal AppUserDetails appUser) {
        log.info("User {} logged in", appUser.getUserId());
        return new ResponseEntity<>(new ApiResponse(ResponseMessage.LOGIN_SUCCESSFUL), HttpStatus.OK);
    }

    @GetMapping("/api/me")
    public ResponseEntity<ApiResponse> me(@AuthenticationPrincipal AppUserDetails appUser) {
        AppUser user = appUserService.loadUserByUsername(appUser.getUsername());

        Map<String, Object> profile = new LinkedHashMap<>();
        profile.put("uid", user.getUid());
        profile.put("username", user.getUsername());
        profile.put("status", user.getStatus());
        profile.put("telegramLinked", user.getTelegramUserId() != null);
        profile.put("notificationChatId", user.getNotificationChatId());
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, profile));
    }

    @GetMapping("/api/logout")
    public ResponseEntity<ApiResponse> logout(HttpServletRequest request, HttpServletResponse response, Authentication authentication) {
        if(authentication != null){
            //clears the SecurityContextHolder and invalidates the HttpSession
            new SecurityContextLogoutHandler().logout(request, response, authentication);
            log.info("User {} logged out", authentication.getName());
        }
        return ResponseEntity.ok().body(new ApiResponse(ResponseMessage.LOGOUT_SUCCESSFUL));
    }

    @GetMapping("/isAuthenticated")
    public ResponseEntity<ApiResponse> isAuthenticated(Authentication authentication) {
        if (authentication != null && authentication.isAuthenticated()
                && !"anonymousUser".equals(authentication.getName())) {
            return ResponseEntity.ok(new ApiResponse("true"));
        }
        return new ResponseEntity<>(new ApiResponse("false"), HttpStatus.UNAUTHORIZED);
    }
}
