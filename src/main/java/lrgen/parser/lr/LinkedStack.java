package lrgen.parser.lr;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Persistent stack, pushing and popping create new stacks that share their tails with the old one.
 */
final class LinkedStack<E> {

	private static final LinkedStack<?> EMPTY = new LinkedStack<>(null, null, 0);

	private final E top;
	private final LinkedStack<E> rest;
	private final int size;

	private LinkedStack(E top, LinkedStack<E> rest, int size) {
		this.top = top;
		this.rest = rest;
		this.size = size;
	}

	@SuppressWarnings("unchecked")
	static <E> LinkedStack<E> empty(){
		return (LinkedStack<E>)EMPTY;
	}

	LinkedStack<E> push(E element){
		return new LinkedStack<>(element, this, size + 1);
	}

	/**
	 * @throws IllegalStateException if the stack has less than <code>count</code> elements
	 */
	LinkedStack<E> pop(int count){
		if (count > size){
			throw new IllegalStateException(String.format("Can't pop %d of %d elements", count, size));
		}
		LinkedStack<E> cur = this;
		for (int i = 0; i < count; i++) {
			cur = cur.rest;
		}
		return cur;
	}

	E peek(){
		if (size == 0){
			throw new IllegalStateException("Empty stack");
		}
		return top;
	}

	int size(){
		return size;
	}

	/**
	 * @return elements from bottom to top, built on every call
	 */
	List<E> toList(){
		Object[] elements = new Object[size];
		LinkedStack<E> cur = this;
		for (int i = size - 1; i >= 0; i--) {
			elements[i] = cur.top;
			cur = cur.rest;
		}
		@SuppressWarnings("unchecked")
		List<E> list = (List<E>)ImmutableList.copyOf(elements);
		return list;
	}
}
