package ou.capstone.rmr.exceptions;

/**
 * RQD cannot be derived for a unit: no supplied value, no usable frequency.
 */
public class InsufficientDataException extends RmrException
{
    private final String unitId;

    public InsufficientDataException( final String unitId, final String msg )
    {
        super( msg + ( unitId == null ? "" : " [" + unitId + "]" ) );
        this.unitId = unitId;
    }

    public String getUnitId()
    {
        return unitId;
    }
}
