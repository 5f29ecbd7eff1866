package com.forum.application.port.out;

import com.forum.domain.model.ReadMark;

import java.util.Collection;

/**
 * Per-(user, discussion) read marks. Both writes are insert-or-update on that key, so concurrent and
 * repeated writes never duplicate rows and retries are harmless.
 */
public interface ReadMarkRepository {
    void upsert(ReadMark mark);

    /**
     * Writes all marks as one batch in one transaction: either every mark lands or none does.
     */
    void upsertAll(Collection<ReadMark> marks);
}
