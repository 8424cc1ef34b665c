package com.tixgo.common.identity;

import com.tixgo.common.enums.UserRole;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CallerRole {

    private String email;
    private UserRole role;
    private boolean fraud;

    public static CallerRole defaultUser(String email) {
        return new CallerRole(email, UserRole.USER, false);
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    public boolean isVendor() {
        return role == UserRole.VENDOR;
    }

    public boolean isVendorInGoodStanding() {
        return isVendor() && !fraud;
    }
}
