// file: engine/src/main/java/io/varlite/engine/pack/SpineSource.java
package io.varlite.engine.pack;

import java.util.List;

/** The spine (base text) that defines which locations exist. */
public interface SpineSource {

    /** Chapters of a book in ascending order; empty when the book is unknown. */
    List<Integer> chapters(String book);

    /** Segments of one chapter in spine order. */
    List<SpineSegment> segments(String book, int chapter);
}
