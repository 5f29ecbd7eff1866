package com.forum.application.port.out;

import com.forum.domain.model.Script;

import java.util.Optional;

/**
 * Read access to the script catalogue, which this service does not own.
 */
public interface ScriptRepository {
    Optional<Script> findById(long id);
}
