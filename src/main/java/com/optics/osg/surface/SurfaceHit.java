package com.optics.osg.surface;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

/**
 * Intersection of a ray with a surface.
 *
 * @param point    intersection point
 * @param normal   unit surface normal at the point (orientation unspecified)
 * @param distance geometric distance travelled from the ray origin
 */
public record SurfaceHit(Point3d point, Vector3d normal, double distance) {
}
