package com.forum.domain.model;

/**
 * A published script that discussions can be attached to. Owned by the script catalogue; read-only here.
 *
 * @param sensitive whether the script belongs to the sensitive content partition
 */
public record Script(
    long id,
    UserId ownerId,
    String name,
    boolean sensitive
) {}
