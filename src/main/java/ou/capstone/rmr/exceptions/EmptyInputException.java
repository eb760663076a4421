package ou.capstone.rmr.exceptions;

/**
 * A station or family has no valid members left to score.
 */
public class EmptyInputException extends RmrException
{
    private final String unitId;

    public EmptyInputException( final String unitId )
    {
        super( "No valid discontinuities in " + unitId );
        this.unitId = unitId;
    }

    public String getUnitId()
    {
        return unitId;
    }
}
