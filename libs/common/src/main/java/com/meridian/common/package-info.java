/**
 * Types shared by every Meridian library: the {@link com.meridian.common.NodeId} and the checked
 * {@link com.meridian.common.MeridianException} hierarchy.
 */
package com.meridian.common;
