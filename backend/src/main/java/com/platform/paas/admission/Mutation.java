package com.platform.paas.admission;

/**
 * One value the gate rewrote, addressed by a pointer-style path
 * such as {@code /containers/web/requests/cpu}.
 */
public record Mutation(String path, String from, String to) {
}
