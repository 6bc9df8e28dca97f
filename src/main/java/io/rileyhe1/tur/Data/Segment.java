package io.rileyhe1.tur.Data;

import java.util.Objects;

/**
 * Percentage range of the file covered by one engine connection, used for display only.
 */
public class Segment
{
    private final int start;
    private final int end;

    public Segment(int start, int end)
    {
        if(start < 0 || start > 100) throw new IllegalArgumentException("Segment start must be within 0..100, was: " + start);
        if(end < 0 || end > 100) throw new IllegalArgumentException("Segment end must be within 0..100, was: " + end);
        if(start > end) throw new IllegalArgumentException("Segment start cannot be after its end: " + start + " > " + end);
        this.start = start;
        this.end = end;
    }

    public int getStart()
    {
        return start;
    }

    public int getEnd()
    {
        return end;
    }

    public int getWidth()
    {
        return end - start;
    }

    @Override
    public boolean equals(Object o)
    {
        if(this == o) return true;
        if(!(o instanceof Segment)) return false;
        Segment other = (Segment) o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(start, end);
    }

    @Override
    public String toString()
    {
        return "Segment[" + start + "-" + end + "]";
    }
}
