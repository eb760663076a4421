package ou.capstone.rmr.exceptions;

/**
 * Base type for every failure raised while scoring a rock mass.
 */
public class RmrException extends Exception
{
    public RmrException( final String msg )
    {
        super( msg );
    }

    public RmrException( final String msg, final Exception e )
    {
        super( msg, e );
    }
}
