package com.optics.osg.ray;

/** What happens to a ray that does not hit the surface it is traced against. */
public enum MissedSurfaceStrategy {
    /** The ray is invalidated. */
    STOP,
    /** The ray continues untouched. */
    IGNORE
}
