package strata.core.model;

/**
 * Point-in-time view of the two cache tiers.
 *
 * @param remoteAvailable whether the remote tier is currently used
 * @param localSize number of entries held by the local tier, expired ones included
 * @param localCapacity maximum number of local entries
 */
public record CacheStatus(boolean remoteAvailable, int localSize, int localCapacity) {}
