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

import java.util.ArrayList;
import java.util.List;

/**
 * Orders {@link Weighted} items by descending weight.
 * <p>
 * Items without a weight are ordered as if their weight was 1.0.
 * Items of equal weight are ordered by reverse declaration order, so that
 * of two items with the same weight, the one found later in the list is
 * placed first.
 * </p>
 */
public class WeightedSort
{
    /**
     * Sort a list in place.
     *
     * @param items the list to sort, which must support {@link List#set(int, Object)}
     * @param <T> the item type
     */
    public static <T extends Weighted> void sort(List<T> items)
    {
        int size = items.size();
        if (size < 2)
            return;

        List<Position<T>> positions = new ArrayList<>(size);
        for (int i = 0; i < size; i++)
        {
            positions.add(new Position<>(items.get(i), i));
        }
        positions.sort(null);

        for (int i = 0; i < size; i++)
        {
            items.set(i, positions.get(i)._item);
        }
    }

    private WeightedSort()
    {
    }

    private static class Position<T extends Weighted> implements Comparable<Position<T>>
    {
        private final T _item;
        private final float _weight;
        private final int _index;

        private Position(T item, int index)
        {
            _item = item;
            _weight = item.getEffectiveWeight();
            _index = index;
        }

        @Override
        public int compareTo(Position<T> o)
        {
            // sort highest weight first
            int compare = Float.compare(o._weight, _weight);
            if (compare == 0)
                // then sort index highest first
                compare = Integer.compare(o._index, _index);
            return compare;
        }

        @Override
        public String toString()
        {
            return String.format("%s@%x[%s,w=%f,i=%d]",
                getClass().getSimpleName(),
                hashCode(),
                _item,
                _weight,
                _index);
        }
    }
}
