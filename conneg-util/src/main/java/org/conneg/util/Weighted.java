//
// ========================================================================
// Copyright (c) 1995-2022 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package org.conneg.util;

/**
 * An item carrying an optional relative weight, such as the quality
 * value of a directive in an HTTP header.
 *
 * @see WeightedSort
 */
public interface Weighted
{
    /**
     * @return the weight in the range [0,1], or null if no weight was given
     */
    Float getWeight();

    /**
     * @return the weight to order by, where a missing weight counts as 1.0
     */
    default float getEffectiveWeight()
    {
        Float weight = getWeight();
        return weight == null ? 1.0F : weight;
    }
}
