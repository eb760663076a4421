package ou.capstone.rmr.exceptions;

import java.util.Locale;

/**
 * A value lies outside its physical bounds, or a total score left [0, 100].
 */
public class InvalidRangeException extends RmrException
{
    private final String field;
    private final double value;
    private final String source;

    public InvalidRangeException( final String field, final double value, final String bounds, final String source )
    {
        super( String.format( Locale.ROOT, "%s=%s outside %s%s", field, format( value ), bounds,
                source == null ? "" : " at " + source ) );
        this.field = field;
        this.value = value;
        this.source = source;
    }

    public String getField()
    {
        return field;
    }

    public double getValue()
    {
        return value;
    }

    public String getSource()
    {
        return source;
    }

    private static String format( final double value )
    {
        return Double.isFinite( value ) ? String.format( Locale.ROOT, "%.3f", value ) : String.valueOf( value );
    }
}
