package com.flairbit.calls.security;

import com.flairbit.calls.exceptions.UnauthorizedException;
import lombok.experimental.UtilityClass;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Objects;
import java.util.UUID;

@UtilityClass
public class CurrentActor {

    public static final String ADMIN_AUTHORITY = "ADMIN";

    public static Actor get() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (Objects.isNull(auth) || Objects.isNull(auth.getName())) {
            throw new UnauthorizedException("No authenticated caller");
        }
        UUID id;
        try {
            id = UUID.fromString(auth.getName());
        } catch (IllegalArgumentException e) {
            throw new UnauthorizedException("Token subject is not a user id");
        }
        boolean admin = auth.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .anyMatch(ADMIN_AUTHORITY::equals);
        return new Actor(id, admin);
    }
}
