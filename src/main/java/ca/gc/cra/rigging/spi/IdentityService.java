package ca.gc.cra.rigging.spi;

import java.util.OptionalLong;

/**
 * Access to the operating system's process identity and user/group databases.
 *
 * @since 0.1.0
 */
public interface IdentityService {

  /**
   * Returns the effective user id of the running process.
   *
   * @return effective uid
   */
  long currentEffectiveUid();

  /**
   * Returns the effective group id of the running process.
   *
   * @return effective gid
   */
  long currentEffectiveGid();

  /**
   * Looks up a user by name.
   *
   * @param name login name
   * @return uid, or empty when no such user exists
   */
  OptionalLong lookupUserByName(String name);

  /**
   * Looks up a group by name.
   *
   * @param name group name
   * @return gid, or empty when no such group exists
   */
  OptionalLong lookupGroupByName(String name);
}
