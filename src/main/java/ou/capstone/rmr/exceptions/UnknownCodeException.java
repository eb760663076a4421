package ou.capstone.rmr.exceptions;

import ou.capstone.rmr.codes.RmrParameter;

/**
 * A field code has no entry in the code dictionary for its parameter.
 */
public class UnknownCodeException extends RmrException
{
    private final RmrParameter parameter;
    private final String code;
    private final String source;

    public UnknownCodeException( final RmrParameter parameter, final String code, final String source )
    {
        super( "Unknown " + parameter + " code '" + code + "'" + ( source == null ? "" : " at " + source ) );
        this.parameter = parameter;
        this.code = code;
        this.source = source;
    }

    public RmrParameter getParameter()
    {
        return parameter;
    }

    public String getCode()
    {
        return code;
    }

    /** Where the bad code came from, e.g. "row 12 (station E-3)"; may be null. */
    public String getSource()
    {
        return source;
    }
}
