package io.b2mash.boq.security;

/** Request-bound identity of the caller. Bound by {@link ActorFilter}, cleared after the request. */
public final class ActorContext {

  private static final ThreadLocal<String> CURRENT_ACTOR_ID = new ThreadLocal<>();
  private static final ThreadLocal<String> CURRENT_ROLE = new ThreadLocal<>();

  private ActorContext() {}

  public static void set(String actorId, String role) {
    CURRENT_ACTOR_ID.set(actorId);
    CURRENT_ROLE.set(role);
  }

  public static String getActorId() {
    return CURRENT_ACTOR_ID.get();
  }

  public static String getRole() {
    return CURRENT_ROLE.get();
  }

  public static boolean isStaff() {
    return Roles.isStaff(CURRENT_ROLE.get());
  }

  public static void clear() {
    CURRENT_ACTOR_ID.remove();
    CURRENT_ROLE.remove();
  }
}
