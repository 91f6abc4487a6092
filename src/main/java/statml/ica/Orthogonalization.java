package statml.ica;

/** How FastICA keeps the rows of the unmixing matrix orthonormal. */
public enum Orthogonalization {

    /** Update all rows together, then W = (WW')^(-1/2) W. Component order carries no meaning. */
    SYMMETRIC,

    /** Extract components one at a time, Gram-Schmidt against the rows already found. */
    DEFLATION;

    public static Orthogonalization parse(String name) {
        switch (name.trim().toLowerCase()) {
            case "symmetric":
            case "parallel":
                return SYMMETRIC;
            case "deflation":
                return DEFLATION;
            default:
                throw new IllegalArgumentException("Unknown orthogonalization: " + name);
        }
    }
}
