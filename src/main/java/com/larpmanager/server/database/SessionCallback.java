package com.larpmanager.server.database;

import org.hibernate.Session;

/**
 * Unit of work run inside a transactional {@link Session}.
 *
 * @param <T> result type
 * @param <E> checked exception the work may throw
 * @see DatabaseManager#withSession(SessionCallback)
 */
@FunctionalInterface
public interface SessionCallback<T, E extends Exception> {

    T doInSession(Session session) throws E;
}
