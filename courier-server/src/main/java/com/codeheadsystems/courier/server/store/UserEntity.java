package com.codeheadsystems.courier.server.store;

import com.codeheadsystems.courier.server.model.User;
import com.codeheadsystems.courier.server.model.UserUpdate;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Row of the {@code courier_users} table, mapped for {@link HibernateUserStore}.
 * Only the store sees this type; callers work with {@link User}.
 */
@Entity
@Table(name = "courier_users")
public class UserEntity {

  @Id
  @Column(name = "email", length = 320, nullable = false)
  private String email;

  @Column(name = "password_hash", length = 128, nullable = false)
  private String passwordHash;

  @Column(name = "handle", nullable = false)
  private String handle;

  @Column(name = "public_key", length = 8192)
  private byte[] publicKey;

  @Column(name = "bio", length = 4096)
  private String bio;

  protected UserEntity() {
  }

  static UserEntity from(User user) {
    UserEntity entity = new UserEntity();
    entity.email = user.email();
    entity.passwordHash = user.passwordHash();
    entity.handle = user.handle();
    entity.publicKey = user.publicKey();
    entity.bio = user.bio();
    return entity;
  }

  User toUser() {
    return new User(email, passwordHash, handle, publicKey, bio);
  }

  void apply(UserUpdate update) {
    if (update.passwordHash() != null) {
      passwordHash = update.passwordHash();
    }
    if (update.handle() != null) {
      handle = update.handle();
    }
    if (update.publicKey() != null) {
      publicKey = update.publicKey();
    }
    if (update.bio() != null) {
      bio = update.bio();
    }
  }

  public String getEmail() {
    return email;
  }

  public String getPasswordHash() {
    return passwordHash;
  }
}
