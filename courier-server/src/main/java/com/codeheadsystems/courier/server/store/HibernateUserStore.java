package com.codeheadsystems.courier.server.store;

import com.codeheadsystems.courier.server.model.User;
import com.codeheadsystems.courier.server.model.UserUpdate;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.hibernate.Session;
import org.hibernate.SessionFactory;
import org.hibernate.Transaction;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relational {@link UserStore} on a Hibernate {@link SessionFactory} mapping {@link UserEntity}.
 * <p>
 * Each call runs in its own session and transaction. Uniqueness of {@code email} is enforced by
 * the primary key, and the conditional update and delete lock the row while they compare the
 * stored password hash.
 */
public class HibernateUserStore implements UserStore {

  private static final Logger log = LoggerFactory.getLogger(HibernateUserStore.class);

  private final SessionFactory sessionFactory;

  public HibernateUserStore(SessionFactory sessionFactory) {
    this.sessionFactory = sessionFactory;
  }

  @Override
  public Optional<User> find(String email) {
    return inTransaction("load user " + email, session ->
        Optional.ofNullable(session.find(UserEntity.class, email)).map(UserEntity::toUser));
  }

  @Override
  public void insert(User user) {
    inTransaction("insert user " + user.email(), session -> {
      session.persist(UserEntity.from(user));
      try {
        session.flush();
      } catch (PersistenceException e) {
        if (isConstraintViolation(e)) {
          throw new DuplicateUserException(user.email(), e);
        }
        throw e;
      }
      log.debug("Inserted user {}", user.email());
      return null;
    });
  }

  @Override
  public Optional<User> update(String email, String expectedPasswordHash, UserUpdate update) {
    return inTransaction("update user " + email, session -> {
      UserEntity entity = lockIfCurrent(session, email, expectedPasswordHash);
      if (entity == null) {
        return Optional.<User>empty();
      }
      entity.apply(update);
      return Optional.of(entity.toUser());
    });
  }

  @Override
  public boolean delete(String email, String expectedPasswordHash) {
    return inTransaction("delete user " + email, session -> {
      UserEntity entity = lockIfCurrent(session, email, expectedPasswordHash);
      if (entity == null) {
        return false;
      }
      session.remove(entity);
      return true;
    });
  }

  @Override
  public List<String> listEmails() {
    return inTransaction("list users", session ->
        session.createQuery("select u.email from UserEntity u order by u.email", String.class)
            .getResultList());
  }

  private static UserEntity lockIfCurrent(Session session, String email, String expectedPasswordHash) {
    UserEntity entity = session.find(UserEntity.class, email, LockModeType.PESSIMISTIC_WRITE);
    if (entity == null || !entity.getPasswordHash().equals(expectedPasswordHash)) {
      return null;
    }
    return entity;
  }

  private <R> R inTransaction(String action, Function<Session, R> work) {
    try (Session session = sessionFactory.openSession()) {
      Transaction transaction = session.beginTransaction();
      try {
        R result = work.apply(session);
        transaction.commit();
        return result;
      } catch (RuntimeException e) {
        if (transaction.getStatus().canRollback()) {
          transaction.rollback();
        }
        throw e;
      }
    } catch (PersistenceException e) {
      throw new UserStoreException("Unable to " + action, e);
    }
  }

  private static boolean isConstraintViolation(Throwable e) {
    for (Throwable cause = e; cause != null; cause = cause.getCause()) {
      if (cause instanceof ConstraintViolationException) {
        return true;
      }
    }
    return false;
  }
}
