package org.caureq.caureqmonitor.api.dto;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

public class IpAddressValidator implements ConstraintValidator<IpAddress, String> {
    private static final Pattern IPV4 = Pattern.compile("^(?:\\d{1,3}\\.){3}\\d{1,3}$");
    // hex groups, colons, optional dotted IPv4 tail; keeps InetAddress away from DNS
    private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9A-Fa-f:.]+$");

    private IpAddress.Family family;

    @Override
    public void initialize(IpAddress annotation) {
        this.family = annotation.value();
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext ctx) {
        if (value == null || value.isBlank()) return true;
        var s = value.trim();
        return family == IpAddress.Family.IPV4 ? isIpv4(s) : isIpv6(s);
    }

    static boolean isIpv4(String s) {
        if (!IPV4.matcher(s).matches()) return false;
        for (var part : s.split("\\.")) {
            if (Integer.parseInt(part) > 255) return false;
        }
        return true;
    }

    static boolean isIpv6(String s) {
        if (!s.contains(":") || !IPV6_CHARS.matcher(s).matches()) return false;
        try {
            InetAddress.getByName(s);
            return true;
        } catch (UnknownHostException e) {
            return false;
        }
    }
}
