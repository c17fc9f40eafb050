package com.eldor.pathfinding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Binary min-heap used as the open set of a search.
 * <p>
 * Membership is tracked by identity, so enqueuing an item that is already queued does nothing.
 * {@link #updatePriority(Comparable)} removes and re-inserts the item, which is linear in the
 * queue size; an indexed heap would make it logarithmic if maps grow large enough to matter.
 *
 * @param <T> queued item, ordered by its natural ordering
 */
public class NodePriorityQueue<T extends Comparable<T>> {

    private final List<T> heap = new ArrayList<>();
    private final Set<T> members = Collections.newSetFromMap(new IdentityHashMap<>());

    public int size() {
        return heap.size();
    }

    public boolean isEmpty() {
        return heap.isEmpty();
    }

    public boolean contains(T item) {
        return members.contains(item);
    }

    public void enqueue(T item) {
        if (!members.add(item)) {
            return;
        }
        heap.add(item);
        siftUp(heap.size() - 1);
    }

    /**
     * Removes and returns the smallest item.
     *
     * @throws NoSuchElementException if the queue is empty
     */
    public T dequeue() {
        if (heap.isEmpty()) {
            throw new NoSuchElementException("Priority queue is empty");
        }
        T front = heap.get(0);
        members.remove(front);

        T last = heap.remove(heap.size() - 1);
        if (!heap.isEmpty()) {
            heap.set(0, last);
            siftDown(0);
        }
        return front;
    }

    /**
     * Re-positions an item whose ordering fields were changed in place. An item that is not
     * queued yet is simply enqueued.
     */
    public void updatePriority(T item) {
        if (members.remove(item)) {
            for (int i = 0; i < heap.size(); i++) {
                if (heap.get(i) == item) {
                    removeAt(i);
                    break;
                }
            }
        }
        enqueue(item);
    }

    public void clear() {
        heap.clear();
        members.clear();
    }

    private void removeAt(int index) {
        T last = heap.remove(heap.size() - 1);
        if (index < heap.size()) {
            heap.set(index, last);
            siftDown(index);
            siftUp(index);
        }
    }

    private void siftUp(int childIndex) {
        while (childIndex > 0) {
            int parentIndex = (childIndex - 1) / 2;
            if (heap.get(childIndex).compareTo(heap.get(parentIndex)) >= 0) {
                break;
            }
            swap(childIndex, parentIndex);
            childIndex = parentIndex;
        }
    }

    private void siftDown(int parentIndex) {
        int lastIndex = heap.size() - 1;
        while (true) {
            int leftChild = parentIndex * 2 + 1;
            if (leftChild > lastIndex) {
                break;
            }
            int rightChild = leftChild + 1;
            int minChild = leftChild;
            if (rightChild <= lastIndex && heap.get(rightChild).compareTo(heap.get(leftChild)) < 0) {
                minChild = rightChild;
            }
            if (heap.get(parentIndex).compareTo(heap.get(minChild)) <= 0) {
                break;
            }
            swap(parentIndex, minChild);
            parentIndex = minChild;
        }
    }

    private void swap(int i, int j) {
        T tmp = heap.get(i);
        heap.set(i, heap.get(j));
        heap.set(j, tmp);
    }
}
